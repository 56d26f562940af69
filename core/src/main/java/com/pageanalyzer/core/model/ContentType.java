package com.pageanalyzer.core.model;

import java.util.Locale;
import java.util.Optional;

/** 분석 디스패치 대상 콘텐츠 유형 (닫힌 집합) */
public enum ContentType {
    HTML,
    FEED,
    API,
    UNKNOWN;

    /** 직렬화/로그용 소문자 이름 */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 호출자 힌트 해석. "auto", 빈 문자열, 모르는 값은 empty.
     * rss/atom/jsonfeed 는 모두 FEED 로 접힌다.
     */
    public static Optional<ContentType> fromHint(String hint) {
        if (hint == null) return Optional.empty();
        String h = hint.trim().toLowerCase(Locale.ROOT);
        return switch (h) {
            case "html", "htm", "page" -> Optional.of(HTML);
            case "feed", "rss", "atom", "jsonfeed", "json-feed" -> Optional.of(FEED);
            case "api", "json", "xml-api" -> Optional.of(API);
            default -> Optional.empty();
        };
    }
}
