package com.pageanalyzer.core.lang;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 통계적 언어 감지.
 * 1) 문자 스크립트 분포 (한글/가나/한자/키릴/아랍 ...) 로 바로 결정
 * 2) 라틴 문자면 불용어 프로파일 적중 수로 결정
 * 텍스트가 {@link #MIN_TEXT_LENGTH} 미만이면 감지하지 않는다 (호출자가 선언 언어로 대체).
 */
public final class LanguageDetector {
    private static final Logger log = LoggerFactory.getLogger(LanguageDetector.class);

    public static final int MIN_TEXT_LENGTH = 50;
    public static final String PROFILE_RESOURCE = "language-profiles.yml";

    /** 감지 결과 */
    public record Detection(String language, double confidence) {}

    private static final Map<Character.UnicodeScript, String> SCRIPT_LANG = Map.of(
            Character.UnicodeScript.HANGUL, "ko",
            Character.UnicodeScript.CYRILLIC, "ru",
            Character.UnicodeScript.ARABIC, "ar",
            Character.UnicodeScript.GREEK, "el",
            Character.UnicodeScript.HEBREW, "he",
            Character.UnicodeScript.THAI, "th",
            Character.UnicodeScript.DEVANAGARI, "hi");

    private static volatile LanguageDetector defaultInstance;

    private final Map<String, Set<String>> profiles;

    LanguageDetector(Map<String, Set<String>> profiles) {
        this.profiles = Map.copyOf(profiles);
    }

    /** 클래스패스 기본 프로파일로 만든 공용 인스턴스 (불변이라 공유 가능) */
    public static LanguageDetector defaultDetector() {
        LanguageDetector d = defaultInstance;
        if (d == null) {
            synchronized (LanguageDetector.class) {
                d = defaultInstance;
                if (d == null) {
                    d = fromClasspath(PROFILE_RESOURCE);
                    defaultInstance = d;
                }
            }
        }
        return d;
    }

    public static LanguageDetector fromClasspath(String resource) {
        try (InputStream in = LanguageDetector.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("language profile resource missing: " + resource);
            Object root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
            Map<String, Set<String>> out = new LinkedHashMap<>();
            if (root instanceof Map<?, ?> m && m.get("profiles") instanceof Map<?, ?> p) {
                for (var e : p.entrySet()) {
                    if (!(e.getValue() instanceof List<?> words)) continue;
                    Set<String> set = new HashSet<>();
                    for (Object w : words) if (w != null) set.add(String.valueOf(w).toLowerCase(Locale.ROOT));
                    out.put(String.valueOf(e.getKey()).toLowerCase(Locale.ROOT), Set.copyOf(set));
                }
            }
            log.debug("Loaded {} language profiles from {}", out.size(), resource);
            return new LanguageDetector(out);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + resource, e);
        }
    }

    public Set<String> supportedProfiles() {
        return profiles.keySet();
    }

    /** 감지 실패(짧은 텍스트, 근거 부족) 시 empty */
    public Optional<Detection> detect(String text) {
        if (text == null || text.strip().length() < MIN_TEXT_LENGTH) return Optional.empty();

        Optional<Detection> byScript = detectByScript(text);
        if (byScript.isPresent()) return byScript;

        return detectByStopwords(text);
    }

    private Optional<Detection> detectByScript(String text) {
        Map<Character.UnicodeScript, Integer> counts = new HashMap<>();
        int letters = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (!Character.isLetter(cp)) continue;
            letters++;
            counts.merge(Character.UnicodeScript.of(cp), 1, Integer::sum);
        }
        if (letters == 0) return Optional.empty();

        int kana = counts.getOrDefault(Character.UnicodeScript.HIRAGANA, 0)
                + counts.getOrDefault(Character.UnicodeScript.KATAKANA, 0);
        int han = counts.getOrDefault(Character.UnicodeScript.HAN, 0);

        // 일본어는 가나가 조금만 섞여도 일본어
        if (kana > 0 && (kana + han) * 1.0 / letters >= 0.3) {
            return Optional.of(new Detection("ja", share(kana + han, letters)));
        }
        String best = null;
        int bestCount = 0;
        for (var e : SCRIPT_LANG.entrySet()) {
            int c = counts.getOrDefault(e.getKey(), 0);
            if (c > bestCount) {
                best = e.getValue();
                bestCount = c;
            }
        }
        if (han > bestCount) {
            best = "zh";
            bestCount = han;
        }
        if (best != null && bestCount * 1.0 / letters >= 0.3) {
            return Optional.of(new Detection(best, share(bestCount, letters)));
        }
        return Optional.empty();
    }

    private Optional<Detection> detectByStopwords(String text) {
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}']+");
        int total = 0;
        Map<String, Integer> hits = new HashMap<>();
        for (String t : tokens) {
            if (t.isEmpty()) continue;
            total++;
            for (var p : profiles.entrySet()) {
                if (p.getValue().contains(t)) hits.merge(p.getKey(), 1, Integer::sum);
            }
        }
        if (total == 0 || hits.isEmpty()) return Optional.empty();

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(hits.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, Integer>comparingByKey()));
        String best = ranked.get(0).getKey();
        int first = ranked.get(0).getValue();
        int second = ranked.size() > 1 ? ranked.get(1).getValue() : 0;
        if (first < 2) return Optional.empty();

        double coverage = Math.min(1.0, (first * 1.0 / total) * 3.0);
        double margin = (first - second) * 1.0 / first;
        double confidence = coverage * (0.5 + 0.5 * margin);
        return Optional.of(new Detection(best, Math.max(0.0, Math.min(1.0, confidence))));
    }

    /** "en-US" → "en". 비었으면 null */
    public static String primaryTag(String declared) {
        if (declared == null) return null;
        String s = declared.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (s.isEmpty()) return null;
        int dash = s.indexOf('-');
        return dash > 0 ? s.substring(0, dash) : s;
    }

    private static double share(int part, int whole) {
        return Math.min(1.0, part * 1.0 / whole);
    }
}
