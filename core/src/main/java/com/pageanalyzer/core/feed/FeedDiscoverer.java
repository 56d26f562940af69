package com.pageanalyzer.core.feed;

import com.pageanalyzer.core.api.IFetcher;
import com.pageanalyzer.core.exception.AnalysisException;
import com.pageanalyzer.core.html.FeedLinkExtractor;
import com.pageanalyzer.core.html.HtmlLinkExtractor;
import com.pageanalyzer.core.model.AnalysisConfig;
import com.pageanalyzer.core.model.ContentType;
import com.pageanalyzer.core.model.FeedDescriptor;
import com.pageanalyzer.core.model.FeedDiscoveryResult;
import com.pageanalyzer.core.model.FetchResponse;
import com.pageanalyzer.core.resolve.ContentTypeResolver;
import com.pageanalyzer.core.service.WorkerPool;
import com.pageanalyzer.core.util.StructuredLog;
import com.pageanalyzer.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * BFS 기반 피드 탐색.
 *  - 루트 자체가 피드면 바로 반환 (direct)
 *  - 아니면 루트 페이지의 피드 링크 수집, depth > 1 이면 같은 사이트 페이지로 BFS
 *    (루트 = 레벨 0, 레벨 L 페이지는 L < depth 일 때만 방문)
 *  - 방문 집합은 호출 범위 (인스턴스 상태 없음)
 *  - validate 면 후보를 워커 풀에서 병렬 검증, 실패한 후보는 버림
 */
public final class FeedDiscoverer {
    private static final Logger LOG = LoggerFactory.getLogger(FeedDiscoverer.class);
    private static final StructuredLog SLOG = StructuredLog.get(FeedDiscoverer.class);

    /** 한 번의 탐색에서 방문할 최대 페이지 수 */
    public static final int MAX_PAGES = 25;

    private static final Set<String> STATIC_EXT = Set.of(
            "css", "js", "png", "jpg", "jpeg", "gif", "ico", "svg", "webp",
            "woff", "woff2", "ttf", "eot", "otf", "map", "pdf", "zip", "rar", "7z",
            "gz", "bz2", "tar", "mp4", "mp3", "wav", "avi", "mov", "mkv", "webm");

    private final IFetcher fetcher;
    private final FeedAnalyzer feedAnalyzer;
    private final Clock clock;

    public FeedDiscoverer(IFetcher fetcher, FeedAnalyzer feedAnalyzer, Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.feedAnalyzer = Objects.requireNonNull(feedAnalyzer, "feedAnalyzer");
        this.clock = (clock == null ? Clock.systemUTC() : clock);
    }

    public FeedDiscoveryResult discover(String url, int depth, boolean validate, AnalysisConfig cfg) {
        final long t0 = System.nanoTime();
        URI root = UrlUtils.parseHttp(url);
        if (root == null) {
            return FeedDiscoveryResult.failed(String.valueOf(url), "invalid URL: " + url, elapsedMs(t0));
        }

        FetchResponse rootResp;
        try {
            rootResp = fetcher.fetch(root, cfg.getTimeout());
        } catch (AnalysisException e) {
            LOG.warn("Feed discovery root fetch failed: {} ({})", url, e.getMessage());
            return FeedDiscoveryResult.failed(url, e.getMessage(), elapsedMs(t0));
        }
        if (rootResp.isHttpError()) {
            return FeedDiscoveryResult.failed(url, "HTTP " + rootResp.getStatusCode(), elapsedMs(t0));
        }
        rootResp = rootResp.truncate(cfg.getMaxContentBytes());

        // ---- 0) 루트가 피드인 경우 ----
        Instant now = clock.instant();
        ContentType rootType = ContentTypeResolver.resolve(url, null, rootResp.head(ContentTypeResolver.SNIFF_BYTES));
        if (rootType == ContentType.FEED) {
            try {
                ParsedFeed feed = feedAnalyzer.parse(rootResp.getBody(), url, cfg.getMaxFeedEntries());
                FeedDescriptor d = feedAnalyzer.describe(root, feed, cfg, now);
                return done(url, List.of(d), FeedDiscoveryResult.METHOD_DIRECT, 1, t0);
            } catch (AnalysisException e) {
                // 피드 모양 URL 이지만 본문은 HTML 인 경우 → 페이지 탐색으로 계속
                LOG.debug("Root looked like a feed but did not parse: {} ({})", url, e.getMessage());
            }
        }

        // ---- 1) BFS ----
        Map<String, FeedLinkExtractor.Candidate> candidates = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        Deque<Node> q = new ArrayDeque<>();
        seen.add(UrlUtils.dedupeKey(root));
        q.addLast(new Node(root, 0));
        int visited = 0;

        while (!q.isEmpty() && visited < MAX_PAGES) {
            if (Thread.currentThread().isInterrupted()) break;
            Node cur = q.pollFirst();

            Document doc = (cur.depth == 0) ? parseHtml(rootResp) : fetchPage(cur.uri, cfg);
            if (doc == null) continue;
            visited++;

            for (FeedLinkExtractor.Candidate c : FeedLinkExtractor.extract(doc, cur.uri, cur.depth == 0)) {
                candidates.putIfAbsent(UrlUtils.dedupeKey(c.uri()), c);
            }

            int next = cur.depth + 1;
            if (next >= Math.max(1, depth)) continue;

            for (URI link : HtmlLinkExtractor.sameSitePages(doc, cur.uri)) {
                if (isStatic(link)) continue;
                if (ContentTypeResolver.fromUrl(link.toString()).isPresent()) continue; // 피드/API 는 페이지 아님
                if (seen.add(UrlUtils.dedupeKey(link))) {
                    q.addLast(new Node(link, next));
                }
            }
        }
        String method = (visited > 1) ? FeedDiscoveryResult.METHOD_CRAWL : FeedDiscoveryResult.METHOD_PAGE_LINKS;

        // ---- 2) 검증 (또는 미검증 후보 그대로) ----
        List<FeedLinkExtractor.Candidate> list = new ArrayList<>(candidates.values());
        List<FeedDescriptor> feeds;
        if (validate) {
            feeds = validateAll(list, cfg, now);
        } else {
            feeds = new ArrayList<>();
            for (FeedLinkExtractor.Candidate c : list) {
                feeds.add(FeedDescriptor.builder().url(c.uri()).feedType(c.typeGuess()).build());
            }
        }
        return done(url, feeds, method, visited, t0);
    }

    private List<FeedDescriptor> validateAll(List<FeedLinkExtractor.Candidate> list, AnalysisConfig cfg, Instant now) {
        if (list.isEmpty()) return List.of();
        try (WorkerPool pool = new WorkerPool("feed-validate", cfg.getMaxConcurrent())) {
            List<FeedDescriptor> results = pool.mapOrdered(list,
                    c -> feedAnalyzer.validate(c.uri(), fetcher, cfg, now),
                    (c, err) -> {
                        LOG.debug("Dropping feed candidate {}: {}", c.uri(), err.getMessage());
                        return null;
                    });
            List<FeedDescriptor> out = new ArrayList<>();
            for (FeedDescriptor d : results) if (d != null) out.add(d);
            return out;
        }
    }

    private Document fetchPage(URI uri, AnalysisConfig cfg) {
        try {
            FetchResponse resp = fetcher.fetch(uri, cfg.getTimeout());
            if (resp.isHttpError()) return null;
            resp = resp.truncate(cfg.getMaxContentBytes());
            if (ContentTypeResolver.sniff(resp.head(ContentTypeResolver.SNIFF_BYTES)) != ContentType.HTML) return null;
            return parseHtml(resp);
        } catch (AnalysisException e) {
            LOG.debug("Skipping page {} during feed discovery: {}", uri, e.getMessage());
            return null;
        }
    }

    private static Document parseHtml(FetchResponse resp) {
        try {
            return Jsoup.parse(new ByteArrayInputStream(resp.getBody()), null, resp.getUrl().toString());
        } catch (IOException e) {
            return null;
        }
    }

    private FeedDiscoveryResult done(String url, List<FeedDescriptor> feeds, String method, int pages, long t0) {
        long ms = elapsedMs(t0);
        LOG.info("Feed discovery done: {} -> {} feeds ({}, pages={}, {}ms)", url, feeds.size(), method, pages, ms);
        SLOG.info("discovery-done",
                "url", url,
                "feeds", feeds.size(),
                "method", method,
                "pages", pages,
                "elapsedMs", ms);
        return new FeedDiscoveryResult(url, feeds, method, pages, ms, null);
    }

    /** 정적 리소스는 BFS 대상에서 제외 */
    private static boolean isStatic(URI u) {
        String p = (u.getPath() == null ? "" : u.getPath().toLowerCase(Locale.ROOT));
        int i = p.lastIndexOf('.');
        if (i < 0) return false;
        return STATIC_EXT.contains(p.substring(i + 1));
    }

    private static long elapsedMs(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }

    private static final class Node {
        final URI uri; final int depth;
        Node(URI u, int d) { this.uri = u; this.depth = d; }
    }
}
