package com.pageanalyzer.core.html;

import com.pageanalyzer.core.model.ContentType;
import com.pageanalyzer.core.model.FeedType;
import com.pageanalyzer.core.resolve.ContentTypeResolver;
import com.pageanalyzer.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 페이지에서 피드 후보 URL 수집. 검증은 하지 않는다 (FeedAnalyzer 몫).
 * 순서: link[rel=alternate] 선언 → 피드 모양 앵커 → (선언/앵커가 없을 때) 흔한 경로 추측.
 */
public final class FeedLinkExtractor {

    public static final int MAX_CANDIDATES = 10;

    public static final List<String> COMMON_PATHS = List.of(
            "/feed", "/rss", "/rss.xml", "/atom.xml", "/feed.xml", "/index.xml", "/feeds/all.atom.xml");

    public enum Source { DECLARED, ANCHOR, COMMON_PATH }

    public record Candidate(URI uri, FeedType typeGuess, Source source) {}

    private FeedLinkExtractor() {}

    /**
     * @param commonPathFallback 페이지에 후보가 하나도 없을 때 흔한 경로를 추측할지
     */
    public static List<Candidate> extract(Document doc, URI base, boolean commonPathFallback) {
        Map<String, Candidate> out = new LinkedHashMap<>();
        if (doc != null) {
            declared(doc, base, out);
            anchors(doc, base, out);
        }
        if (out.isEmpty() && commonPathFallback && UrlUtils.isHttp(base)) {
            for (String path : COMMON_PATHS) {
                if (out.size() >= MAX_CANDIDATES) break;
                URI u = base.resolve(path);
                add(out, new Candidate(u, FeedType.guess(null, path), Source.COMMON_PATH));
            }
        }
        return new ArrayList<>(out.values());
    }

    private static void declared(Document doc, URI base, Map<String, Candidate> out) {
        for (Element link : doc.select("link[href]")) {
            String rel = link.attr("rel").toLowerCase(Locale.ROOT);
            if (!rel.contains("alternate")) continue;
            String type = link.attr("type").toLowerCase(Locale.ROOT);
            if (!(type.contains("rss") || type.contains("atom") || type.contains("feed") || type.contains("xml"))) continue;
            URI u = UrlUtils.resolve(base, link.attr("href"));
            if (u == null) continue;
            add(out, new Candidate(u, FeedType.guess(type, u.toString()), Source.DECLARED));
        }
    }

    private static void anchors(Document doc, URI base, Map<String, Candidate> out) {
        for (Element a : doc.select("a[href]")) {
            if (out.size() >= MAX_CANDIDATES) return;
            URI u = UrlUtils.resolve(base, a.attr("href"));
            if (u == null) continue;
            if (ContentTypeResolver.fromUrl(u.toString()).orElse(null) != ContentType.FEED) continue;
            add(out, new Candidate(u, FeedType.guess(null, u.toString()), Source.ANCHOR));
        }
    }

    private static void add(Map<String, Candidate> out, Candidate c) {
        if (out.size() >= MAX_CANDIDATES) return;
        out.putIfAbsent(UrlUtils.dedupeKey(c.uri()), c);
    }
}
