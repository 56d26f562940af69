package com.pageanalyzer.core.feed;

import com.pageanalyzer.core.FakeFetcher;
import com.pageanalyzer.core.api.AnalysisContext;
import com.pageanalyzer.core.exception.ContentParseException;
import com.pageanalyzer.core.exception.FeedValidationException;
import com.pageanalyzer.core.model.AnalysisConfig;
import com.pageanalyzer.core.model.AnalysisRecord;
import com.pageanalyzer.core.model.ContentType;
import com.pageanalyzer.core.model.FeedDescriptor;
import com.pageanalyzer.core.model.FeedType;
import com.pageanalyzer.core.model.FetchResponse;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class FeedAnalyzerTest {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
    static final Instant NOW = CLOCK.instant();

    static final String RSS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0"><channel>
              <title>Example Blog</title>
              <link>https://example.com/</link>
              <description>Posts about &lt;b&gt;things&lt;/b&gt;</description>
              <language>en-us</language>
              <item><title>First post</title><link>https://example.com/p/1</link>
                <description>&lt;p&gt;Body of the first post&lt;/p&gt;</description>
                <pubDate>Mon, 27 May 2024 10:00:00 GMT</pubDate></item>
              <item><title>Second post</title><link>https://example.com/p/2</link>
                <pubDate>Fri, 10 May 2024 08:00:00 GMT</pubDate></item>
            </channel></rss>
            """;

    static final String ATOM = """
            <?xml version="1.0" encoding="utf-8"?>
            <feed xmlns="http://www.w3.org/2005/Atom">
              <title>Atom Example</title>
              <link href="https://example.org/"/>
              <updated>2024-05-30T12:00:00Z</updated>
              <id>urn:uuid:60a76c80-d399-11d9-b93C-0003939e0af6</id>
              <entry>
                <title>Atom entry</title>
                <link href="https://example.org/e/1"/>
                <id>urn:uuid:1225c695-cfb8-4ebb-aaaa-80da344efa6a</id>
                <updated>2024-05-30T12:00:00Z</updated>
                <summary>Short summary</summary>
              </entry>
            </feed>
            """;

    static final String JSON_FEED = """
            {
              "version": "https://jsonfeed.org/version/1.1",
              "title": "JSON Example",
              "home_page_url": "https://example.net/",
              "language": "de-DE",
              "items": [
                {"id": "1", "title": "Hallo", "url": "https://example.net/1",
                 "content_html": "<p>Erster Beitrag</p>", "date_published": "2024-05-20T09:00:00Z"},
                {"id": "2", "title": "Zweiter", "content_text": "Noch einer"}
              ]
            }
            """;

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static FetchResponse response(String url, String contentType, String body) {
        return FetchResponse.builder().url(URI.create(url)).statusCode(200)
                .header("Content-Type", contentType).body(body).build();
    }

    // ---------- parse ----------

    @Test
    void rss_is_parsed_with_entries_language_and_bodyless_ratio() {
        ParsedFeed feed = new FeedAnalyzer().parse(bytes(RSS), "https://example.com/feed.xml", 100);

        assertEquals(FeedType.RSS, feed.feedType());
        assertEquals("Example Blog", feed.title());
        assertEquals("Posts about things", feed.description());
        assertEquals("en", feed.language());
        assertEquals(2, feed.entries().size());
        assertEquals("Body of the first post", feed.entries().get(0).content());
        assertNull(feed.entries().get(1).content());
        assertEquals(0.5, feed.bodylessRatio(), 1e-9);
        assertEquals(Instant.parse("2024-05-27T10:00:00Z"), feed.newestEntryDate());
    }

    @Test
    void atom_and_json_feed_are_recognised() {
        FeedAnalyzer fa = new FeedAnalyzer();

        ParsedFeed atom = fa.parse(bytes(ATOM), "https://example.org/atom.xml", 100);
        assertEquals(FeedType.ATOM, atom.feedType());
        assertEquals("Atom Example", atom.title());
        assertEquals("Short summary", atom.entries().get(0).content());

        ParsedFeed json = fa.parse(bytes(JSON_FEED), "https://example.net/feed.json", 100);
        assertEquals(FeedType.JSON, json.feedType());
        assertEquals("de", json.language());
        assertEquals("Erster Beitrag", json.entries().get(0).content());
        assertEquals("Noch einer", json.entries().get(1).content());
        assertEquals(Instant.parse("2024-05-20T09:00:00Z"), json.entries().get(0).publishedAt());
    }

    @Test
    void max_entries_truncates_but_total_is_kept() {
        ParsedFeed feed = new FeedAnalyzer().parse(bytes(RSS), "https://example.com/feed.xml", 1);

        assertEquals(1, feed.entries().size());
        assertEquals(2, feed.totalEntries());
    }

    @Test
    void malformed_input_raises_parse_exception() {
        FeedAnalyzer fa = new FeedAnalyzer();

        assertThrows(ContentParseException.class, () -> fa.parse(bytes("<rss><channel><title>x"), "u", 10));
        assertThrows(ContentParseException.class, () -> fa.parse(bytes("{\"items\": []}"), "u", 10));
        assertThrows(ContentParseException.class, () -> fa.parse(new byte[0], "u", 10));
    }

    // ---------- isActive ----------

    @Test
    void activity_window_and_regular_cadence() {
        // 창 안의 엔트리
        assertTrue(FeedAnalyzer.isActive(List.of(NOW.minus(Duration.ofDays(10))), NOW, 90));
        // 날짜 없음
        assertFalse(FeedAnalyzer.isActive(List.of(), NOW, 90));
        // 창 밖 2건은 규칙성 판단 불가
        assertFalse(FeedAnalyzer.isActive(List.of(
                NOW.minus(Duration.ofDays(100)), NOW.minus(Duration.ofDays(160))), NOW, 90));
        // 60일 간격 규칙적 + 최신이 평균 간격 2배 이내
        assertTrue(FeedAnalyzer.isActive(List.of(
                NOW.minus(Duration.ofDays(100)),
                NOW.minus(Duration.ofDays(160)),
                NOW.minus(Duration.ofDays(220))), NOW, 90));
        // 불규칙
        assertFalse(FeedAnalyzer.isActive(List.of(
                NOW.minus(Duration.ofDays(100)),
                NOW.minus(Duration.ofDays(101)),
                NOW.minus(Duration.ofDays(300))), NOW, 90));
    }

    // ---------- validate ----------

    @Test
    void validate_describes_real_feeds() {
        FakeFetcher f = new FakeFetcher().xml("https://example.com/feed.xml", RSS);

        FeedDescriptor d = new FeedAnalyzer().validate(URI.create("https://example.com/feed.xml"), f,
                AnalysisConfig.defaults(), NOW);

        assertEquals(FeedType.RSS, d.getFeedType());
        assertEquals(2, d.getEntryCount());
        assertEquals("en", d.getLanguage());
        assertEquals(Instant.parse("2024-05-27T10:00:00Z"), d.getLastUpdated());
        assertTrue(d.isActive());
    }

    @Test
    void validate_rejects_html_and_http_errors() {
        FakeFetcher f = new FakeFetcher()
                .html("https://example.com/not-feed", "<html><head><title>x</title></head><body><p>hi</p></body></html>");
        FeedAnalyzer fa = new FeedAnalyzer();

        assertThrows(FeedValidationException.class, () ->
                fa.validate(URI.create("https://example.com/not-feed"), f, AnalysisConfig.defaults(), NOW));
        assertThatThrownBy(() ->
                fa.validate(URI.create("https://example.com/missing.xml"), f, AnalysisConfig.defaults(), NOW))
                .isInstanceOf(FeedValidationException.class)
                .hasMessageContaining("HTTP 404");
    }

    // ---------- analyze ----------

    @Test
    void feed_is_rendered_as_page_content() {
        AnalysisContext ctx = new AnalysisContext("https://example.com/feed.xml",
                AnalysisConfig.defaults().setExtractLinks(true), CLOCK);

        AnalysisRecord r = new FeedAnalyzer()
                .analyze(response("https://example.com/feed.xml", "application/rss+xml", RSS), ctx)
                .build();

        assertEquals(ContentType.FEED, r.getResolvedContentType());
        assertEquals("Example Blog", r.getTitle());
        assertEquals("Title: First post\n\nBody of the first post\n\nTitle: Second post", r.getMainContent());
        assertEquals("Recent entries: First post; Second post", r.getSummary());
        assertEquals("en", r.getLanguage());
        assertEquals(0.5, r.getSignals().bodylessEntryRatio(), 1e-9);
        assertTrue(r.getSignals().structuredMetadata());
        assertThat(r.getExternalLinks()).containsExactly(
                URI.create("https://example.com/p/1"), URI.create("https://example.com/p/2"));
        assertNotNull(ctx.lastCheckpoint());
    }

    @Test
    void feed_without_entries_uses_description_as_content() {
        String empty = """
                <?xml version="1.0"?>
                <rss version="2.0"><channel><title>Quiet</title><link>https://q.example/</link>
                <description>Nothing yet</description></channel></rss>
                """;
        AnalysisContext ctx = new AnalysisContext("https://q.example/rss", AnalysisConfig.defaults(), CLOCK);

        AnalysisRecord r = new FeedAnalyzer().analyze(response("https://q.example/rss", "application/rss+xml", empty), ctx).build();

        assertEquals("Nothing yet", r.getMainContent());
        assertNull(r.getSummary());
    }
}
