package com.pageanalyzer.core.model;

import com.pageanalyzer.core.util.YamlConfigLoader;

import java.time.Duration;
import java.util.Map;

/**
 * 분석 설정 (analyzer.yml 매핑 대상).
 * 요청별 옵션 맵은 {@link #withOptions(Map)} 로 기본 설정 위에 덮어쓴다.
 */
public final class AnalysisConfig {

    public static final String DEFAULT_USER_AGENT = "page-analyzer/0.3 (+content-analysis)";

    // ---------- 기본 필드 ----------
    private Duration timeout = Duration.ofMillis(30_000);
    private int maxContentBytes = 1_000_000;   // 초과분은 파싱 전에 잘라냄
    private boolean extractLinks = false;
    private boolean extractImages = false;
    private boolean includeSameOriginLinks = false;
    private boolean discoverFeeds = true;
    private boolean calculateScores = true;
    private boolean detectLanguage = true;
    private int maxConcurrent = 5;
    private int summaryLength = 500;
    private String userAgent = DEFAULT_USER_AGENT;

    // ---------- scoring ----------
    private int freshnessHorizonDays = 365;
    private int freshnessHalfLifeDays = 30;

    // ---------- feeds ----------
    private int feedActivityWindowDays = 90;
    private int maxFeedEntries = 100;
    private int feedDiscoveryDepth = 2;
    private boolean validateFeeds = true;

    // ---------- getters ----------
    public Duration getTimeout() { return timeout; }
    public long getTimeoutMs() { return timeout.toMillis(); }
    public int getMaxContentBytes() { return maxContentBytes; }
    public boolean isExtractLinks() { return extractLinks; }
    public boolean isExtractImages() { return extractImages; }
    public boolean isIncludeSameOriginLinks() { return includeSameOriginLinks; }
    public boolean isDiscoverFeeds() { return discoverFeeds; }
    public boolean isCalculateScores() { return calculateScores; }
    public boolean isDetectLanguage() { return detectLanguage; }
    public int getMaxConcurrent() { return maxConcurrent; }
    public int getSummaryLength() { return summaryLength; }
    public String getUserAgent() { return userAgent; }
    public int getFreshnessHorizonDays() { return freshnessHorizonDays; }
    public int getFreshnessHalfLifeDays() { return freshnessHalfLifeDays; }
    public int getFeedActivityWindowDays() { return feedActivityWindowDays; }
    public int getMaxFeedEntries() { return maxFeedEntries; }
    public int getFeedDiscoveryDepth() { return feedDiscoveryDepth; }
    public boolean isValidateFeeds() { return validateFeeds; }

    // ---------- fluent setters ----------
    public AnalysisConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public AnalysisConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }
    public AnalysisConfig setMaxContentBytes(int v) { this.maxContentBytes = v; return this; }
    public AnalysisConfig setExtractLinks(boolean v) { this.extractLinks = v; return this; }
    public AnalysisConfig setExtractImages(boolean v) { this.extractImages = v; return this; }
    public AnalysisConfig setIncludeSameOriginLinks(boolean v) { this.includeSameOriginLinks = v; return this; }
    public AnalysisConfig setDiscoverFeeds(boolean v) { this.discoverFeeds = v; return this; }
    public AnalysisConfig setCalculateScores(boolean v) { this.calculateScores = v; return this; }
    public AnalysisConfig setDetectLanguage(boolean v) { this.detectLanguage = v; return this; }
    public AnalysisConfig setMaxConcurrent(int v) { this.maxConcurrent = Math.max(1, v); return this; }
    public AnalysisConfig setSummaryLength(int v) { this.summaryLength = v; return this; }
    public AnalysisConfig setUserAgent(String v) { this.userAgent = v; return this; }
    public AnalysisConfig setFreshnessHorizonDays(int v) { this.freshnessHorizonDays = v; return this; }
    public AnalysisConfig setFreshnessHalfLifeDays(int v) { this.freshnessHalfLifeDays = v; return this; }
    public AnalysisConfig setFeedActivityWindowDays(int v) { this.feedActivityWindowDays = v; return this; }
    public AnalysisConfig setMaxFeedEntries(int v) { this.maxFeedEntries = v; return this; }
    public AnalysisConfig setFeedDiscoveryDepth(int v) { this.feedDiscoveryDepth = v; return this; }
    public AnalysisConfig setValidateFeeds(boolean v) { this.validateFeeds = v; return this; }

    // ---------- validate ----------
    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeoutMs must be > 0");
        if (maxContentBytes < 1) throw new IllegalArgumentException("maxContentBytes must be >= 1");
        if (maxConcurrent < 1) throw new IllegalArgumentException("maxConcurrent must be >= 1");
        if (summaryLength < 1) throw new IllegalArgumentException("summaryLength must be >= 1");
        if (freshnessHalfLifeDays < 1) throw new IllegalArgumentException("scoring.freshnessHalfLifeDays must be >= 1");
        if (freshnessHorizonDays < 1) throw new IllegalArgumentException("scoring.freshnessHorizonDays must be >= 1");
        if (feedActivityWindowDays < 0) throw new IllegalArgumentException("feeds.activityWindowDays must be >= 0");
        if (maxFeedEntries < 1) throw new IllegalArgumentException("feeds.maxEntries must be >= 1");
        if (feedDiscoveryDepth < 0) throw new IllegalArgumentException("feeds.discoveryDepth must be >= 0");
        if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;
    }

    // ---------- helpers ----------
    public static AnalysisConfig defaults() { return new AnalysisConfig(); }

    public AnalysisConfig copy() {
        AnalysisConfig c = new AnalysisConfig();
        c.timeout = timeout;
        c.maxContentBytes = maxContentBytes;
        c.extractLinks = extractLinks;
        c.extractImages = extractImages;
        c.includeSameOriginLinks = includeSameOriginLinks;
        c.discoverFeeds = discoverFeeds;
        c.calculateScores = calculateScores;
        c.detectLanguage = detectLanguage;
        c.maxConcurrent = maxConcurrent;
        c.summaryLength = summaryLength;
        c.userAgent = userAgent;
        c.freshnessHorizonDays = freshnessHorizonDays;
        c.freshnessHalfLifeDays = freshnessHalfLifeDays;
        c.feedActivityWindowDays = feedActivityWindowDays;
        c.maxFeedEntries = maxFeedEntries;
        c.feedDiscoveryDepth = feedDiscoveryDepth;
        c.validateFeeds = validateFeeds;
        return c;
    }

    /**
     * 이 설정의 복사본 위에 옵션 맵을 덮어쓴 새 설정. 원본은 변경하지 않는다.
     * 키 규칙은 analyzer.yml 과 동일하며, 모르는 키는 무시한다.
     */
    public AnalysisConfig withOptions(Map<String, ?> options) {
        AnalysisConfig merged = copy();
        if (options == null || options.isEmpty()) return merged;
        YamlConfigLoader.apply(options, merged);
        merged.validate();
        return merged;
    }
}
