package com.pageanalyzer.core.service;

import com.pageanalyzer.core.FakeFetcher;
import com.pageanalyzer.core.api.AnalysisContext;
import com.pageanalyzer.core.api.IContentAnalyzer;
import com.pageanalyzer.core.model.AnalysisConfig;
import com.pageanalyzer.core.model.AnalysisRecord;
import com.pageanalyzer.core.model.AnalysisStatus;
import com.pageanalyzer.core.model.ApiAnalysisRecord;
import com.pageanalyzer.core.model.BatchResult;
import com.pageanalyzer.core.model.ContentType;
import com.pageanalyzer.core.model.FetchResponse;
import com.pageanalyzer.core.model.PageMetadata;
import com.pageanalyzer.core.model.Scores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AnalysisManagerTest {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    static final String FOO_BAR = "<html><head><title>Foo</title>"
            + "<meta name=\"description\" content=\"Bar\"></head>"
            + "<body><p>Hello</p></body></html>";

    static final String RSS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0"><channel>
              <title>Example Blog</title>
              <link>https://example.com/</link>
              <description>Posts about things</description>
              <item><title>First post</title><link>https://example.com/p/1</link>
                <description>Body of the first post</description>
                <pubDate>Mon, 27 May 2024 10:00:00 GMT</pubDate></item>
            </channel></rss>
            """;

    private AnalysisManager manager;

    private AnalysisManager manager(FakeFetcher f, AnalysisConfig cfg) {
        manager = new AnalysisManager(f, cfg, CLOCK);
        return manager;
    }

    @AfterEach
    void tearDown() {
        if (manager != null) manager.close();
    }

    @Test
    void html_example_yields_title_description_and_success() {
        FakeFetcher f = new FakeFetcher().html("https://example.com/page", FOO_BAR);

        AnalysisRecord r = manager(f, AnalysisConfig.defaults()).analyzeOne("https://example.com/page");

        assertEquals(AnalysisStatus.SUCCESS, r.getStatus());
        assertEquals(ContentType.HTML, r.getResolvedContentType());
        assertEquals("Foo", r.getTitle());
        assertEquals("Bar", r.getDescription());
        assertEquals("Hello", r.getMainContent());
        assertEquals(200, r.getStatusCode());
        assertEquals(CLOCK.instant(), r.getAnalyzedAt());
        assertNull(r.getErrorMessage());
    }

    @Test
    void same_input_and_clock_give_identical_records() {
        FakeFetcher f = new FakeFetcher().html("https://example.com/page", FOO_BAR);
        AnalysisManager m = manager(f, AnalysisConfig.defaults());

        AnalysisRecord a = m.analyzeOne("https://example.com/page");
        AnalysisRecord b = m.analyzeOne("https://example.com/page");

        assertEquals(a.getScores(), b.getScores());
        assertEquals(a.getTitle(), b.getTitle());
        assertEquals(a.getMainContent(), b.getMainContent());
        assertEquals(a.getSummary(), b.getSummary());
    }

    @Test
    void blocked_status_codes_map_to_blocked() {
        FakeFetcher f = new FakeFetcher().status("https://example.com/secret", 403);

        AnalysisRecord r = manager(f, AnalysisConfig.defaults()).analyzeOne("https://example.com/secret");

        assertEquals(AnalysisStatus.BLOCKED, r.getStatus());
        assertEquals(403, r.getStatusCode());
        assertThat(r.getErrorMessage()).contains("403");
        assertEquals(Scores.ZERO, r.getScores());
    }

    @Test
    void server_error_maps_to_error() {
        FakeFetcher f = new FakeFetcher().status("https://example.com/broken", 500);

        AnalysisRecord r = manager(f, AnalysisConfig.defaults()).analyzeOne("https://example.com/broken");

        assertEquals(AnalysisStatus.ERROR, r.getStatus());
        assertEquals("HTTP 500", r.getErrorMessage());
    }

    @Test
    void invalid_or_blank_url_returns_error_record_without_fetching() {
        FakeFetcher f = new FakeFetcher();
        AnalysisManager m = manager(f, AnalysisConfig.defaults());

        AnalysisRecord blank = m.analyzeOne("  ");
        AnalysisRecord bad = m.analyzeOne("ftp://example.com/file");
        AnalysisRecord nul = m.analyzeOne((String) null);

        for (AnalysisRecord r : List.of(blank, bad, nul)) {
            assertEquals(AnalysisStatus.ERROR, r.getStatus());
            assertEquals(ContentType.UNKNOWN, r.getResolvedContentType());
            assertNotNull(r.getErrorMessage());
        }
        assertThat(bad.getErrorMessage()).startsWith("invalid URL");
        assertTrue(f.calls().isEmpty(), "nothing should be fetched");
    }

    @Test
    void transport_failure_becomes_error_record() {
        FakeFetcher f = new FakeFetcher().fail("https://down.example.com/", "connection refused");

        AnalysisRecord r = manager(f, AnalysisConfig.defaults()).analyzeOne("https://down.example.com/");

        assertEquals(AnalysisStatus.ERROR, r.getStatus());
        assertThat(r.getErrorMessage()).contains("fetch failed").contains("connection refused");
    }

    @Test
    void slow_fetch_times_out_with_message() {
        FakeFetcher f = new FakeFetcher().html("https://slow.example.com/", FOO_BAR).delay("https://slow.example.com/", 3_000);
        AnalysisConfig cfg = AnalysisConfig.defaults().setTimeoutMs(300);

        long t0 = System.nanoTime();
        AnalysisRecord r = manager(f, cfg).analyzeOne("https://slow.example.com/");
        long ms = (System.nanoTime() - t0) / 1_000_000;

        assertEquals(AnalysisStatus.TIMEOUT, r.getStatus());
        assertEquals("analysis timed out after 300ms", r.getErrorMessage());
        assertTrue(ms < 2_500, "deadline should release the caller early, took " + ms + "ms");
    }

    @Test
    void timeout_during_analysis_returns_last_checkpoint() {
        FakeFetcher f = new FakeFetcher().html("https://example.com/stuck", FOO_BAR);
        // 제목까지 체크포인트 후 멈추는 분석기
        IContentAnalyzer stuck = new IContentAnalyzer() {
            @Override
            public ContentType contentType() {
                return ContentType.HTML;
            }

            @Override
            public AnalysisRecord.Builder analyze(FetchResponse response, AnalysisContext ctx) {
                AnalysisRecord.Builder b = ctx.lastCheckpoint().toBuilder().title("Partial title");
                ctx.checkpoint(b);
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return b;
            }
        };
        manager = new AnalysisManager(f, AnalysisConfig.defaults().setTimeoutMs(300), CLOCK, List.of(stuck));

        AnalysisRecord r = manager.analyzeOne("https://example.com/stuck");

        assertEquals(AnalysisStatus.TIMEOUT, r.getStatus());
        assertEquals("analysis timed out after 300ms", r.getErrorMessage());
        assertEquals("Partial title", r.getTitle());
        assertEquals(ContentType.HTML, r.getResolvedContentType());
        assertEquals(200, r.getStatusCode());
        assertEquals(Scores.ZERO, r.getScores());
    }

    @Test
    void feed_url_is_rendered_as_page_record() {
        FakeFetcher f = new FakeFetcher().xml("https://example.com/feed.xml", RSS);

        AnalysisRecord r = manager(f, AnalysisConfig.defaults()).analyzeOne("https://example.com/feed.xml");

        assertEquals(AnalysisStatus.SUCCESS, r.getStatus());
        assertEquals(ContentType.FEED, r.getResolvedContentType());
        assertEquals("Example Blog", r.getTitle());
        assertThat(r.getMainContent()).startsWith("Title: First post");
        assertEquals("Recent entries: First post", r.getSummary());
        assertEquals(Instant.parse("2024-05-27T10:00:00Z"), r.getPublishedAt());
    }

    @Test
    void api_url_is_rendered_as_page_record() {
        FakeFetcher f = new FakeFetcher().json("https://example.com/api/posts",
                "{\"data\":[{\"title\":\"A\",\"body\":\"hi\"},{\"title\":\"B\"}]}");

        AnalysisRecord r = manager(f, AnalysisConfig.defaults()).analyzeOne("https://example.com/api/posts");

        assertEquals(AnalysisStatus.SUCCESS, r.getStatus());
        assertEquals(ContentType.API, r.getResolvedContentType());
        assertEquals("API Data: A", r.getTitle());
        assertEquals("Structured API data containing 2 items", r.getDescription());
        assertEquals("Title: A\nContent: hi\n\n---\n\nTitle: B", r.getMainContent());
        assertEquals("API contains 2 items. Recent: A; B", r.getSummary());
    }

    @Test
    void content_type_hint_overrides_url_and_sniffing() {
        FakeFetcher f = new FakeFetcher().stub("https://example.com/export", 200, "text/plain", RSS);

        AnalysisRecord r = manager(f, AnalysisConfig.defaults())
                .analyzeOne("https://example.com/export", "rss", Map.of());

        assertEquals(ContentType.FEED, r.getResolvedContentType());
        assertEquals(AnalysisStatus.SUCCESS, r.getStatus());
    }

    @Test
    void api_error_envelope_becomes_error_record() {
        FakeFetcher f = new FakeFetcher().json("https://example.com/api/items",
                "{\"error\":{\"code\":401,\"message\":\"token expired\"}}");

        AnalysisRecord r = manager(f, AnalysisConfig.defaults()).analyzeOne("https://example.com/api/items");

        assertEquals(AnalysisStatus.ERROR, r.getStatus());
        assertEquals(ContentType.API, r.getResolvedContentType());
        assertThat(r.getErrorMessage()).contains("token expired");
    }

    @Test
    void page_without_text_is_an_error() {
        FakeFetcher f = new FakeFetcher().html("https://example.com/empty", "<html><head><title>T</title></head><body></body></html>");

        AnalysisRecord r = manager(f, AnalysisConfig.defaults()).analyzeOne("https://example.com/empty");

        assertEquals(AnalysisStatus.ERROR, r.getStatus());
        assertEquals("no extractable content", r.getErrorMessage());
    }

    @Test
    void binary_payload_resolves_unknown_without_content() {
        FakeFetcher f = new FakeFetcher().stub("https://example.com/download", 200, "application/pdf", "%PDF-1.7 binary");

        AnalysisRecord r = manager(f, AnalysisConfig.defaults()).analyzeOne("https://example.com/download");

        assertEquals(ContentType.UNKNOWN, r.getResolvedContentType());
        assertEquals(AnalysisStatus.SUCCESS, r.getStatus());
        assertFalse(r.hasContent());
        assertEquals(Scores.ZERO, r.getScores());
    }

    @Test
    void per_request_options_override_base_config() {
        FakeFetcher f = new FakeFetcher().html("https://example.com/page", FOO_BAR);
        AnalysisManager m = manager(f, AnalysisConfig.defaults());

        AnalysisRecord scored = m.analyzeOne("https://example.com/page");
        AnalysisRecord unscored = m.analyzeOne("https://example.com/page", null, Map.of("calculateScores", false));

        assertThat(scored.getScores().relevance()).isGreaterThan(0.0);
        assertEquals(Scores.ZERO, unscored.getScores());
        assertTrue(m.getConfig().isCalculateScores(), "base config must not change");
    }

    @Test
    void invalid_options_give_error_record() {
        FakeFetcher f = new FakeFetcher().html("https://example.com/page", FOO_BAR);

        AnalysisRecord r = manager(f, AnalysisConfig.defaults())
                .analyzeOne("https://example.com/page", null, Map.of("timeoutMs", "soon"));

        assertEquals(AnalysisStatus.ERROR, r.getStatus());
        assertThat(r.getErrorMessage()).startsWith("invalid options").contains("timeoutMs");
    }

    @Test
    void oversized_payload_is_truncated_but_reports_full_length() {
        String big = "<html><head><title>Big</title></head><body><p>" + "word ".repeat(400) + "</p></body></html>";
        FakeFetcher f = new FakeFetcher().html("https://example.com/big", big);
        AnalysisConfig cfg = AnalysisConfig.defaults().setMaxContentBytes(200);

        AnalysisRecord r = manager(f, cfg).analyzeOne("https://example.com/big");

        assertEquals(AnalysisStatus.SUCCESS, r.getStatus());
        assertEquals(big.length(), r.getContentLength());
        assertThat(r.getMainContent().length()).isLessThan(200);
    }

    // ---------- batch ----------

    @Test
    void batch_keeps_input_order_and_isolates_timeout() {
        FakeFetcher f = new FakeFetcher()
                .html("https://a.example.com/", FOO_BAR)
                .html("https://b.example.com/", FOO_BAR).delay("https://b.example.com/", 5_000)
                .html("https://c.example.com/", FOO_BAR);
        AnalysisConfig cfg = AnalysisConfig.defaults().setTimeoutMs(1_500);

        BatchResult res = manager(f, cfg).analyzeBatch(
                List.of("https://a.example.com/", "https://b.example.com/", "https://c.example.com/"));

        List<AnalysisStatus> statuses = new ArrayList<>();
        for (AnalysisRecord r : res.records()) statuses.add(r.getStatus());
        assertEquals(List.of(AnalysisStatus.SUCCESS, AnalysisStatus.TIMEOUT, AnalysisStatus.SUCCESS), statuses);
        assertEquals("https://b.example.com/", res.records().get(1).getUrl());
        assertEquals(2, res.aggregate().succeeded());
        assertEquals(1, res.aggregate().timedOut());
        assertEquals(0, res.aggregate().failed());
    }

    @Test
    void batch_counts_blocked_and_errors_as_failed() {
        FakeFetcher f = new FakeFetcher()
                .html("https://ok.example.com/", FOO_BAR)
                .status("https://blocked.example.com/", 429);

        BatchResult res = manager(f, AnalysisConfig.defaults()).analyzeBatch(
                Arrays.asList("https://ok.example.com/", "https://blocked.example.com/", "not a url"), 2, null);

        assertEquals(3, res.records().size());
        assertEquals(AnalysisStatus.BLOCKED, res.records().get(1).getStatus());
        assertEquals(AnalysisStatus.ERROR, res.records().get(2).getStatus());
        assertEquals(1, res.aggregate().succeeded());
        assertEquals(2, res.aggregate().failed());
    }

    @Test
    void empty_batch_and_duplicate_urls() {
        FakeFetcher f = new FakeFetcher().html("https://example.com/page", FOO_BAR);
        AnalysisManager m = manager(f, AnalysisConfig.defaults());

        BatchResult empty = m.analyzeBatch(List.of());
        assertTrue(empty.records().isEmpty());
        assertEquals(0, empty.aggregate().succeeded());

        BatchResult dup = m.analyzeBatch(List.of("https://example.com/page", "https://example.com/page"));
        assertEquals(2, dup.records().size());
        assertEquals(2, dup.aggregate().succeeded());
        assertEquals(2, f.callCount("https://example.com/page"));
    }

    // ---------- api payload / metadata ----------

    @Test
    void api_payload_example_has_two_records_and_half_quality() {
        AnalysisManager m = manager(new FakeFetcher(), AnalysisConfig.defaults());

        ApiAnalysisRecord r = m.analyzeApiPayload("https://example.com/api",
                "{\"data\":[{\"title\":\"A\",\"body\":\"hi\"},{\"title\":\"B\"}]}", null);

        assertEquals(2, r.getTotalRecords());
        assertEquals(0.5, r.getDataQuality(), 1e-9);
        assertThat(r.getDetectedStructure()).contains("data");
        assertNull(r.getErrorMessage());
    }

    @Test
    void api_payload_without_body_fetches_endpoint() {
        FakeFetcher f = new FakeFetcher().json("https://example.com/api/posts",
                "[{\"title\":\"A\",\"body\":\"x\"},{\"title\":\"B\",\"body\":\"y\"}]");

        ApiAnalysisRecord r = manager(f, AnalysisConfig.defaults())
                .analyzeApiPayload("https://example.com/api/posts", null, null);

        // 1) 엔드포인트를 한 번 가져온다
        assertEquals(1, f.callCount("https://example.com/api/posts"));
        // 2) 가져온 본문이 그대로 분석된다
        assertNull(r.getErrorMessage());
        assertEquals(2, r.getTotalRecords());
        assertEquals("https://example.com/api/posts", r.getEndpointUrl());
    }

    @Test
    void api_payload_fetch_failures_become_error_records() {
        FakeFetcher f = new FakeFetcher()
                .status("https://example.com/api/missing", 404)
                .fail("https://down.example.com/api", "connection refused");
        AnalysisManager m = manager(f, AnalysisConfig.defaults());

        ApiAnalysisRecord missing = m.analyzeApiPayload("https://example.com/api/missing", null, null);
        assertTrue(missing.isError());
        assertThat(missing.getErrorMessage()).startsWith("Failed to fetch API data").contains("HTTP 404");
        assertEquals(0, missing.getTotalRecords());

        ApiAnalysisRecord down = m.analyzeApiPayload("https://down.example.com/api", null, null);
        assertThat(down.getErrorMessage()).startsWith("Failed to fetch API data").contains("connection refused");

        ApiAnalysisRecord invalid = m.analyzeApiPayload("not a url", null, null);
        assertTrue(invalid.isError());
        assertThat(f.calls()).hasSize(2);
    }

    @Test
    void quick_metadata_skips_content_processing() {
        String html = "<html lang=\"en-GB\"><head><title>Foo</title><meta name=\"description\" content=\"Bar\">"
                + "<meta name=\"author\" content=\"Jane Roe\"></head><body><p>Hello</p></body></html>";
        FakeFetcher f = new FakeFetcher().html("https://example.com/page", html);

        PageMetadata md = manager(f, AnalysisConfig.defaults()).getPageMetadata("https://example.com/page", true);

        assertEquals("Foo", md.title());
        assertEquals("Bar", md.description());
        assertEquals("Jane Roe", md.author());
        assertEquals("en", md.language());
        assertEquals(ContentType.HTML, md.contentType());
        assertEquals(200, md.statusCode());
        assertNull(md.errorMessage());
    }

    @Test
    void full_metadata_projects_analysis_record() {
        FakeFetcher f = new FakeFetcher().html("https://example.com/page", FOO_BAR);

        PageMetadata md = manager(f, AnalysisConfig.defaults()).getPageMetadata("https://example.com/page", false);

        assertEquals("Foo", md.title());
        assertEquals(ContentType.HTML, md.contentType());
    }

    @Test
    void metadata_for_missing_page_reports_error() {
        PageMetadata md = manager(new FakeFetcher(), AnalysisConfig.defaults())
                .getPageMetadata("https://example.com/missing", true);

        assertEquals("HTTP 404", md.errorMessage());
        assertEquals(404, md.statusCode());
    }
}
