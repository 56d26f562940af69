package com.pageanalyzer.core.model;

import java.util.Map;

/**
 * 단건 분석 요청.
 * @param url 분석 대상 (null/blank 허용: 결과는 unknown + error)
 * @param contentTypeHint "html" | "feed" | "api" | "auto" 등, 없으면 null
 * @param options 기본 설정 위에 덮어쓸 옵션 (nullable)
 */
public record AnalysisRequest(String url, String contentTypeHint, Map<String, Object> options) {

    public AnalysisRequest {
        options = (options == null ? Map.of() : Map.copyOf(options));
    }

    public static AnalysisRequest of(String url) {
        return new AnalysisRequest(url, null, null);
    }

    public static AnalysisRequest of(String url, String hint) {
        return new AnalysisRequest(url, hint, null);
    }
}
