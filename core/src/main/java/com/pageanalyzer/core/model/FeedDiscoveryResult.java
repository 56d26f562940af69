package com.pageanalyzer.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 피드 탐색 결과.
 * feeds 는 정규화 키 기준 중복 제거 + 발견 순서 유지.
 */
public record FeedDiscoveryResult(String sourceUrl,
                                  List<FeedDescriptor> feeds,
                                  String discoveryMethod,
                                  int pagesVisited,
                                  long discoveryTimeMs,
                                  String errorMessage) {

    public static final String METHOD_DIRECT = "direct";
    public static final String METHOD_PAGE_LINKS = "page-links";
    public static final String METHOD_CRAWL = "crawl";

    public FeedDiscoveryResult {
        Objects.requireNonNull(sourceUrl, "sourceUrl");
        feeds = (feeds == null ? List.of() : List.copyOf(feeds));
        discoveryMethod = (discoveryMethod == null ? METHOD_PAGE_LINKS : discoveryMethod);
        pagesVisited = Math.max(0, pagesVisited);
        discoveryTimeMs = Math.max(0L, discoveryTimeMs);
    }

    public int totalFeeds() {
        return feeds.size();
    }

    public static FeedDiscoveryResult failed(String sourceUrl, String message, long elapsedMs) {
        return new FeedDiscoveryResult(sourceUrl, List.of(), METHOD_PAGE_LINKS, 0, elapsedMs, message);
    }
}
