package com.pageanalyzer.core.util;

import com.pageanalyzer.core.model.AnalysisConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * analyzer.yml 을 읽어 AnalysisConfig 로 변환.
 * 같은 키 규칙이 요청별 옵션 맵에도 쓰인다 ({@link #apply(Map, AnalysisConfig)}).
 * 키 비교는 대소문자/밑줄/하이픈 무시 (extract_links == extractLinks).
 *
 * 예상 YAML 키:
 * timeoutMs: 30000
 * maxContentBytes: 1000000
 * extractLinks: false
 * extractImages: false
 * includeSameOriginLinks: false
 * discoverFeeds: true
 * calculateScores: true
 * detectLanguage: true
 * maxConcurrent: 5
 * summaryLength: 500
 * userAgent: "page-analyzer/0.3"
 *
 * scoring:
 *   freshnessHalfLifeDays: 30
 *   freshnessHorizonDays: 365
 *
 * feeds:
 *   activityWindowDays: 90
 *   maxEntries: 100
 *   discoveryDepth: 2
 *   validate: true
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "analyzer.yml";

    private YamlConfigLoader() {}

    public static AnalysisConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static AnalysisConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** 클래스패스 리소스에서 로드 (테스트/번들 기본값) */
    public static AnalysisConfig loadResource(String resource) throws IOException {
        Objects.requireNonNull(resource, "resource");
        try (InputStream in = YamlConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IOException("classpath resource not found: " + resource);
            return load(in);
        }
    }

    public static AnalysisConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        AnalysisConfig cfg = AnalysisConfig.defaults();
        if (root instanceof Map<?, ?> map) {
            apply(map, cfg);
        }
        cfg.validate();
        return cfg;
    }

    /**
     * 평면 키 + scoring/feeds 섹션을 cfg 에 덮어쓴다. 모르는 키는 무시.
     * 옵션 맵에서는 섹션 없이 평면 키(feedActivityWindowDays 등)도 받는다.
     */
    public static void apply(Map<?, ?> map, AnalysisConfig cfg) {
        Objects.requireNonNull(cfg, "cfg");
        if (map == null) return;

        // 1) 평면 키
        setLong(map, "timeoutMs", cfg::setTimeoutMs);
        setInt(map, "maxContentBytes", cfg::setMaxContentBytes);
        setBoolean(map, "extractLinks", cfg::setExtractLinks);
        setBoolean(map, "extractImages", cfg::setExtractImages);
        setBoolean(map, "includeSameOriginLinks", cfg::setIncludeSameOriginLinks);
        setBoolean(map, "discoverFeeds", cfg::setDiscoverFeeds);
        setBoolean(map, "calculateScores", cfg::setCalculateScores);
        setBoolean(map, "detectLanguage", cfg::setDetectLanguage);
        setInt(map, "maxConcurrent", cfg::setMaxConcurrent);
        setInt(map, "summaryLength", cfg::setSummaryLength);
        setString(map, "userAgent", cfg::setUserAgent);

        setInt(map, "freshnessHalfLifeDays", cfg::setFreshnessHalfLifeDays);
        setInt(map, "freshnessHorizonDays", cfg::setFreshnessHorizonDays);
        setInt(map, "feedActivityWindowDays", cfg::setFeedActivityWindowDays);
        setInt(map, "maxFeedEntries", cfg::setMaxFeedEntries);
        setInt(map, "feedDiscoveryDepth", cfg::setFeedDiscoveryDepth);
        setBoolean(map, "validateFeeds", cfg::setValidateFeeds);

        // 2) scoring.*
        Map<?, ?> scoring = getMap(map, "scoring");
        if (scoring != null) {
            setInt(scoring, "freshnessHalfLifeDays", cfg::setFreshnessHalfLifeDays);
            setInt(scoring, "freshnessHorizonDays", cfg::setFreshnessHorizonDays);
        }

        // 3) feeds.*
        Map<?, ?> feeds = getMap(map, "feeds");
        if (feeds != null) {
            setInt(feeds, "activityWindowDays", cfg::setFeedActivityWindowDays);
            setInt(feeds, "maxEntries", cfg::setMaxFeedEntries);
            setInt(feeds, "discoveryDepth", cfg::setFeedDiscoveryDepth);
            setBoolean(feeds, "validate", cfg::setValidateFeeds);
        }
    }

    // ------------ helpers ------------
    private static Object get(Map<?, ?> map, String key) {
        Object direct = map.get(key);
        if (direct != null) return direct;
        String want = canon(key);
        for (var e : map.entrySet()) {
            if (e.getKey() != null && canon(String.valueOf(e.getKey())).equals(want)) return e.getValue();
        }
        return null;
    }

    private static String canon(String k) {
        return k.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }

    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = get(map, key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = get(map, key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = get(map, key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = get(map, key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseNumber(key, v).intValue());
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = get(map, key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(parseNumber(key, v).longValue());
    }

    private static Number parseNumber(String key, Object v) {
        String s = String.valueOf(v).trim();
        try {
            return s.contains(".") ? (Number) Double.parseDouble(s) : (Number) Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be numeric: " + s, e);
        }
    }
}
