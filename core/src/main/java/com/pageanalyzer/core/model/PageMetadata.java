package com.pageanalyzer.core.model;

import java.time.Instant;

/** 본문 처리 없이 뽑는 가벼운 페이지 메타데이터 */
public record PageMetadata(String url,
                           String title,
                           String description,
                           String language,
                           String author,
                           Instant publishedAt,
                           Instant lastModifiedAt,
                           ContentType contentType,
                           Integer statusCode,
                           long responseTimeMs,
                           long contentLength,
                           String errorMessage) {

    public static PageMetadata error(String url, String message) {
        return new PageMetadata(url, null, null, null, null, null, null,
                ContentType.UNKNOWN, null, 0L, 0L, message);
    }

    public static PageMetadata from(AnalysisRecord r) {
        return new PageMetadata(r.getUrl(), r.getTitle(), r.getDescription(), r.getLanguage(),
                r.getAuthor(), r.getPublishedAt(), r.getLastModifiedAt(), r.getResolvedContentType(),
                r.getStatusCode(), r.getTiming().responseTimeMs(), r.getContentLength(), r.getErrorMessage());
    }
}
