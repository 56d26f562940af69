package com.pageanalyzer.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;

/** 검증(또는 후보 단계)된 피드 1건 요약. discovery 호출 동안만 유효. */
public final class FeedDescriptor {
    private final URI url;
    private final String title;
    private final String description;
    private final FeedType feedType;
    private final Instant lastUpdated;
    private final int entryCount;
    private final boolean active;
    private final String language;

    private FeedDescriptor(Builder b) {
        this.url = b.url;
        this.title = b.title;
        this.description = b.description;
        this.feedType = b.feedType;
        this.lastUpdated = b.lastUpdated;
        this.entryCount = Math.max(0, b.entryCount);
        this.active = b.active;
        this.language = b.language;
    }

    public URI getUrl() { return url; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public FeedType getFeedType() { return feedType; }
    public Instant getLastUpdated() { return lastUpdated; }
    public int getEntryCount() { return entryCount; }
    public boolean isActive() { return active; }
    public String getLanguage() { return language; }

    @Override
    public String toString() {
        return "FeedDescriptor{" + feedType.wireName() + " " + url + ", entries=" + entryCount + ", active=" + active + '}';
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private String title;
        private String description;
        private FeedType feedType = FeedType.RSS;
        private Instant lastUpdated;
        private int entryCount;
        private boolean active;
        private String language;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder feedType(FeedType feedType) { this.feedType = feedType; return this; }
        public Builder lastUpdated(Instant lastUpdated) { this.lastUpdated = lastUpdated; return this; }
        public Builder entryCount(int entryCount) { this.entryCount = entryCount; return this; }
        public Builder active(boolean active) { this.active = active; return this; }
        public Builder language(String language) { this.language = language; return this; }

        public FeedDescriptor build() {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(feedType, "feedType");
            return new FeedDescriptor(this);
        }
    }
}
