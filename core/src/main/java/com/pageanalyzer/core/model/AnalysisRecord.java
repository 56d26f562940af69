package com.pageanalyzer.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 단일 URL 분석 결과 (불변).
 * 성공/실패/타임아웃 모두 이 레코드 하나로 표현한다.
 */
public final class AnalysisRecord {
    private final String url;
    private final ContentType resolvedContentType;
    private final AnalysisStatus status;

    private final String title;
    private final String description;
    private final String mainContent;
    private final String summary;

    private final String language;
    private final String author;
    private final URI canonicalUrl;
    private final Instant publishedAt;
    private final Instant lastModifiedAt;

    private final Scores scores;
    private final ContentSignals signals;

    private final Set<URI> discoveredFeeds;
    private final List<URI> images;
    private final List<URI> externalLinks;

    private final Integer statusCode;    // nullable (fetch 전 실패)
    private final long contentLength;
    private final Timing timing;
    private final String errorMessage;
    private final Instant analyzedAt;

    private AnalysisRecord(Builder b) {
        this.url = b.url;
        this.resolvedContentType = (b.resolvedContentType == null ? ContentType.UNKNOWN : b.resolvedContentType);
        this.status = b.status;
        this.title = b.title;
        this.description = b.description;
        this.mainContent = b.mainContent;
        this.summary = b.summary;
        this.language = b.language;
        this.author = b.author;
        this.canonicalUrl = b.canonicalUrl;
        this.publishedAt = b.publishedAt;
        this.lastModifiedAt = b.lastModifiedAt;
        this.scores = (b.scores == null ? Scores.ZERO : b.scores);
        this.signals = (b.signals == null ? ContentSignals.NONE : b.signals);
        this.discoveredFeeds = Collections.unmodifiableSet(new LinkedHashSet<>(b.discoveredFeeds));
        this.images = List.copyOf(b.images);
        this.externalLinks = List.copyOf(b.externalLinks);
        this.statusCode = b.statusCode;
        this.contentLength = Math.max(0L, b.contentLength);
        this.timing = (b.timing == null ? Timing.NONE : b.timing);
        this.errorMessage = b.errorMessage;
        this.analyzedAt = (b.analyzedAt == null ? Instant.now() : b.analyzedAt);
    }

    public String getUrl() { return url; }
    public ContentType getResolvedContentType() { return resolvedContentType; }
    public AnalysisStatus getStatus() { return status; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getMainContent() { return mainContent; }
    public String getSummary() { return summary; }
    public String getLanguage() { return language; }
    public String getAuthor() { return author; }
    public URI getCanonicalUrl() { return canonicalUrl; }
    public Instant getPublishedAt() { return publishedAt; }
    public Instant getLastModifiedAt() { return lastModifiedAt; }
    public Scores getScores() { return scores; }
    public ContentSignals getSignals() { return signals; }
    public Set<URI> getDiscoveredFeeds() { return discoveredFeeds; }
    public List<URI> getImages() { return images; }
    public List<URI> getExternalLinks() { return externalLinks; }
    public Integer getStatusCode() { return statusCode; }
    public long getContentLength() { return contentLength; }
    public Timing getTiming() { return timing; }
    public String getErrorMessage() { return errorMessage; }
    public Instant getAnalyzedAt() { return analyzedAt; }

    public boolean isSuccess() { return status == AnalysisStatus.SUCCESS; }

    public boolean hasContent() {
        return mainContent != null && !mainContent.isBlank();
    }

    /** 현재 값을 복사한 빌더 (타임아웃 부분결과 변환 등에 사용) */
    public Builder toBuilder() {
        return new Builder()
                .url(url)
                .resolvedContentType(resolvedContentType)
                .status(status)
                .title(title)
                .description(description)
                .mainContent(mainContent)
                .summary(summary)
                .language(language)
                .author(author)
                .canonicalUrl(canonicalUrl)
                .publishedAt(publishedAt)
                .lastModifiedAt(lastModifiedAt)
                .scores(scores)
                .signals(signals)
                .discoveredFeeds(discoveredFeeds)
                .images(images)
                .externalLinks(externalLinks)
                .statusCode(statusCode)
                .contentLength(contentLength)
                .timing(timing)
                .errorMessage(errorMessage)
                .analyzedAt(analyzedAt);
    }

    @Override
    public String toString() {
        return "AnalysisRecord{url=" + url + ", type=" + resolvedContentType.wireName()
                + ", status=" + status.wireName() + ", title=" + title
                + (errorMessage != null ? ", error=" + errorMessage : "") + '}';
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private ContentType resolvedContentType;
        private AnalysisStatus status = AnalysisStatus.SUCCESS;
        private String title;
        private String description;
        private String mainContent;
        private String summary;
        private String language;
        private String author;
        private URI canonicalUrl;
        private Instant publishedAt;
        private Instant lastModifiedAt;
        private Scores scores;
        private ContentSignals signals;
        private final Set<URI> discoveredFeeds = new LinkedHashSet<>();
        private final List<URI> images = new ArrayList<>();
        private final List<URI> externalLinks = new ArrayList<>();
        private Integer statusCode;
        private long contentLength;
        private Timing timing;
        private String errorMessage;
        private Instant analyzedAt;

        public Builder url(String url) { this.url = url; return this; }
        public Builder resolvedContentType(ContentType t) { this.resolvedContentType = t; return this; }
        public Builder status(AnalysisStatus status) { this.status = status; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder mainContent(String mainContent) { this.mainContent = mainContent; return this; }
        public Builder summary(String summary) { this.summary = summary; return this; }
        public Builder language(String language) { this.language = language; return this; }
        public Builder author(String author) { this.author = author; return this; }
        public Builder canonicalUrl(URI canonicalUrl) { this.canonicalUrl = canonicalUrl; return this; }
        public Builder publishedAt(Instant publishedAt) { this.publishedAt = publishedAt; return this; }
        public Builder lastModifiedAt(Instant lastModifiedAt) { this.lastModifiedAt = lastModifiedAt; return this; }
        public Builder scores(Scores scores) { this.scores = scores; return this; }
        public Builder signals(ContentSignals signals) { this.signals = signals; return this; }

        public Builder discoveredFeeds(Collection<URI> feeds) {
            this.discoveredFeeds.clear();
            if (feeds != null) feeds.stream().filter(Objects::nonNull).forEach(this.discoveredFeeds::add);
            return this;
        }
        public Builder images(Collection<URI> images) {
            this.images.clear();
            if (images != null) images.stream().filter(Objects::nonNull).forEach(this.images::add);
            return this;
        }
        public Builder externalLinks(Collection<URI> links) {
            this.externalLinks.clear();
            if (links != null) links.stream().filter(Objects::nonNull).forEach(this.externalLinks::add);
            return this;
        }

        public Builder statusCode(Integer statusCode) { this.statusCode = statusCode; return this; }
        public Builder contentLength(long contentLength) { this.contentLength = contentLength; return this; }
        public Builder timing(Timing timing) { this.timing = timing; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder analyzedAt(Instant analyzedAt) { this.analyzedAt = analyzedAt; return this; }

        // 스코어링/조립 단계에서 중간 값 참조용
        public String url() { return url; }
        public String title() { return title; }
        public String description() { return description; }
        public String mainContent() { return mainContent; }
        public String author() { return author; }
        public String language() { return language; }
        public Instant publishedAt() { return publishedAt; }
        public Instant lastModifiedAt() { return lastModifiedAt; }
        public ContentType resolvedContentType() { return resolvedContentType; }
        public ContentSignals signals() { return signals == null ? ContentSignals.NONE : signals; }

        public AnalysisRecord build() {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(status, "status");
            return new AnalysisRecord(this);
        }
    }
}
