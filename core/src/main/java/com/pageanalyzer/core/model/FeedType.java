package com.pageanalyzer.core.model;

import java.util.Locale;

public enum FeedType {
    RSS,
    ATOM,
    JSON;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** MIME type 또는 URL 조각으로 피드 종류 추정. 판단 불가면 RSS. */
    public static FeedType guess(String mimeType, String url) {
        String t = (mimeType == null ? "" : mimeType.toLowerCase(Locale.ROOT));
        String u = (url == null ? "" : url.toLowerCase(Locale.ROOT));
        if (t.contains("json") || u.endsWith(".json") || u.contains("feed.json")) return JSON;
        if (t.contains("atom") || u.contains("atom")) return ATOM;
        return RSS;
    }
}
