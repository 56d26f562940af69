package com.pageanalyzer.core.html;

import com.pageanalyzer.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** jsoup 기반 링크/이미지 추출: a[href], img[src] → 절대 URI (문서 순서, 중복 제거) */
public final class HtmlLinkExtractor {

    public static final int MAX_LINKS = 50;
    public static final int MAX_IMAGES = 20;

    private HtmlLinkExtractor() {}

    /**
     * 링크 수집. 기본은 외부(다른 호스트) 링크만.
     * @param includeSameOrigin true 면 같은 사이트 링크도 포함
     */
    public static List<URI> links(Document doc, URI base, boolean includeSameOrigin, int cap) {
        Map<String, URI> out = new LinkedHashMap<>();
        if (doc == null) return List.of();
        for (Element a : doc.select("a[href]")) {
            if (out.size() >= cap) break;
            URI u = UrlUtils.resolve(base, a.attr("href"));
            if (u == null) continue;
            if (!includeSameOrigin && base != null && UrlUtils.sameDomain(base, u)) continue;
            out.putIfAbsent(UrlUtils.dedupeKey(u), u);
        }
        return new ArrayList<>(out.values());
    }

    public static List<URI> images(Document doc, URI base, int cap) {
        Map<String, URI> out = new LinkedHashMap<>();
        if (doc == null) return List.of();
        for (Element img : doc.select("img[src], img[data-src]")) {
            if (out.size() >= cap) break;
            String src = img.hasAttr("src") && !img.attr("src").isBlank() ? img.attr("src") : img.attr("data-src");
            URI u = UrlUtils.resolve(base, src);
            if (u == null) continue;
            out.putIfAbsent(UrlUtils.dedupeKey(u), u);
        }
        return new ArrayList<>(out.values());
    }

    /** 같은 사이트 페이지 링크 (피드 탐색 BFS 용, 상한 없음) */
    public static Set<URI> sameSitePages(Document doc, URI base) {
        Set<URI> out = new LinkedHashSet<>();
        if (doc == null || base == null) return out;
        for (Element a : doc.select("a[href]")) {
            URI u = UrlUtils.resolve(base, a.attr("href"));
            if (u == null || !UrlUtils.sameDomain(base, u)) continue;
            out.add(UrlUtils.normalize(u));
        }
        return out;
    }
}
