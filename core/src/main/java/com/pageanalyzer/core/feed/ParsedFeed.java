package com.pageanalyzer.core.feed;

import com.pageanalyzer.core.model.FeedType;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 파싱된 피드 (RSS/Atom/JSON Feed 공통 형태).
 * entries 는 문서 순서, maxEntries 로 이미 잘린 상태.
 */
public record ParsedFeed(FeedType feedType,
                         String title,
                         String description,
                         String link,
                         String language,
                         Instant lastUpdated,
                         List<Entry> entries,
                         int totalEntries) {

    public ParsedFeed {
        Objects.requireNonNull(feedType, "feedType");
        entries = (entries == null ? List.of() : List.copyOf(entries));
        totalEntries = Math.max(totalEntries, entries.size());
    }

    /** 엔트리 1건. content 는 태그 제거된 본문(없으면 null) */
    public record Entry(String title, String link, String content, Instant publishedAt) {
        public boolean hasBody() {
            return content != null && !content.isBlank();
        }
    }

    /** 가장 최근 엔트리 날짜, 없으면 null */
    public Instant newestEntryDate() {
        return entries.stream()
                .map(Entry::publishedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }

    public List<Instant> entryDates() {
        return entries.stream().map(Entry::publishedAt).filter(Objects::nonNull).toList();
    }

    /** 본문 없는(제목만) 엔트리 비율 */
    public double bodylessRatio() {
        if (entries.isEmpty()) return 0.0;
        long bodyless = entries.stream().filter(e -> !e.hasBody()).count();
        return bodyless / (double) entries.size();
    }
}
