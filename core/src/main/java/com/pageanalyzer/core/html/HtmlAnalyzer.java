package com.pageanalyzer.core.html;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pageanalyzer.core.api.AnalysisContext;
import com.pageanalyzer.core.api.IContentAnalyzer;
import com.pageanalyzer.core.exception.AnalysisException;
import com.pageanalyzer.core.exception.ContentParseException;
import com.pageanalyzer.core.lang.LanguageDetector;
import com.pageanalyzer.core.model.AnalysisConfig;
import com.pageanalyzer.core.model.AnalysisRecord;
import com.pageanalyzer.core.model.ContentSignals;
import com.pageanalyzer.core.model.ContentType;
import com.pageanalyzer.core.model.FetchResponse;
import com.pageanalyzer.core.util.DateParsing;
import com.pageanalyzer.core.util.TextUtils;
import com.pageanalyzer.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * HTML 문서 분석: 메타데이터, 본문, 요약, 언어, 링크/이미지, 피드 후보.
 * 잘못된 HTML 은 jsoup 의 관대한 파서로 최대한 처리한다.
 */
public final class HtmlAnalyzer implements IContentAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(HtmlAnalyzer.class);
    private static final ObjectMapper OM = new ObjectMapper();

    public static final int MAX_TITLE = 200;
    public static final int MAX_DESCRIPTION = 500;
    public static final int MAX_AUTHOR = 100;

    /** 본문 날짜 휴리스틱이 보는 앞부분 길이 */
    private static final int DATE_SCAN_CHARS = 2000;
    /** 선언 언어로 대체할 때의 신뢰도 */
    static final double DECLARED_LANGUAGE_CONFIDENCE = 0.5;

    private static final List<String> TITLE_SELECTORS = List.of(
            "title", "meta[property=og:title]", "meta[name=twitter:title]", "h1");
    private static final List<String> DESCRIPTION_SELECTORS = List.of(
            "meta[name=description]", "meta[property=og:description]", "meta[name=twitter:description]");
    private static final List<String> AUTHOR_SELECTORS = List.of(
            "meta[name=author]", "meta[property=article:author]", "meta[name=twitter:creator]",
            "[rel=author]", ".author", ".byline");
    private static final List<String> PUBLISHED_META = List.of(
            "meta[property=article:published_time]", "meta[name=date]", "meta[name=publishdate]",
            "meta[name=pubdate]", "meta[name=dc.date]", "meta[name=DC.date.issued]", "[itemprop=datePublished]");
    private static final List<String> MODIFIED_META = List.of(
            "meta[property=article:modified_time]", "meta[name=last-modified]",
            "meta[property=og:updated_time]", "[itemprop=dateModified]");
    private static final String STRUCTURED_MARKERS =
            "meta[property^=og:], meta[property^=article:], script[type=application/ld+json], [itemprop]";

    private final LanguageDetector languageDetector;

    public HtmlAnalyzer() {
        this(LanguageDetector.defaultDetector());
    }

    public HtmlAnalyzer(LanguageDetector languageDetector) {
        this.languageDetector = languageDetector;
    }

    @Override
    public ContentType contentType() {
        return ContentType.HTML;
    }

    @Override
    public AnalysisRecord.Builder analyze(FetchResponse response, AnalysisContext ctx) {
        AnalysisConfig cfg = ctx.config();
        URI base = response.getUrl();
        AnalysisRecord.Builder b = AnalysisRecord.builder()
                .url(ctx.url())
                .resolvedContentType(ContentType.HTML);
        try {
            Document doc = parse(response);

            // 1) 메타데이터
            boolean structured = !doc.select(STRUCTURED_MARKERS).isEmpty();
            b.title(firstText(doc, TITLE_SELECTORS, MAX_TITLE))
             .description(firstText(doc, DESCRIPTION_SELECTORS, MAX_DESCRIPTION))
             .author(firstText(doc, AUTHOR_SELECTORS, MAX_AUTHOR))
             .canonicalUrl(canonical(doc, base))
             .lastModifiedAt(lastModified(doc, response.header("Last-Modified")));
            String declaredLang = declaredLanguage(doc);
            b.language(declaredLang);
            ctx.checkpoint(b);
            checkInterrupted(ctx);

            // 2) 본문/요약
            MainContentExtractor.Extraction ex = MainContentExtractor.extract(doc);
            if (!ex.isEmpty()) {
                b.mainContent(ex.text())
                 .summary(TextUtils.cutAtWord(TextUtils.squash(ex.text()), cfg.getSummaryLength()));
            }
            b.publishedAt(published(doc, ex.text()));
            b.signals(new ContentSignals(ex.boilerplateRatio(), 0.0, structured, 0.0));
            ctx.checkpoint(b);
            checkInterrupted(ctx);

            // 3) 언어
            if (cfg.isDetectLanguage() && languageDetector != null) {
                Optional<LanguageDetector.Detection> d = languageDetector.detect(ex.text());
                if (d.isPresent()) {
                    b.language(d.get().language());
                    b.signals(b.signals().withLanguageConfidence(d.get().confidence()));
                } else if (declaredLang != null) {
                    b.signals(b.signals().withLanguageConfidence(DECLARED_LANGUAGE_CONFIDENCE));
                }
            }

            // 4) 링크/이미지/피드 후보
            if (cfg.isExtractLinks()) {
                b.externalLinks(HtmlLinkExtractor.links(doc, base, cfg.isIncludeSameOriginLinks(), HtmlLinkExtractor.MAX_LINKS));
            }
            if (cfg.isExtractImages()) {
                b.images(HtmlLinkExtractor.images(doc, base, HtmlLinkExtractor.MAX_IMAGES));
            }
            if (cfg.isDiscoverFeeds()) {
                b.discoveredFeeds(FeedLinkExtractor.extract(doc, base, false).stream()
                        .map(FeedLinkExtractor.Candidate::uri)
                        .toList());
            }
            ctx.checkpoint(b);
            return b;
        } catch (AnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("HTML extraction failed for {}: {}", ctx.url(), e.toString());
            throw ContentParseException.extractionFailed(ctx.url(), e);
        }
    }

    /** 메타데이터만 (quick mode) */
    public AnalysisRecord.Builder metadataOnly(FetchResponse response, AnalysisContext ctx) {
        Document doc = parse(response);
        return AnalysisRecord.builder()
                .url(ctx.url())
                .resolvedContentType(ContentType.HTML)
                .title(firstText(doc, TITLE_SELECTORS, MAX_TITLE))
                .description(firstText(doc, DESCRIPTION_SELECTORS, MAX_DESCRIPTION))
                .author(firstText(doc, AUTHOR_SELECTORS, MAX_AUTHOR))
                .language(declaredLanguage(doc))
                .canonicalUrl(canonical(doc, response.getUrl()))
                .publishedAt(published(doc, null))
                .lastModifiedAt(lastModified(doc, response.header("Last-Modified")));
    }

    // ---------- parsing ----------
    static Document parse(FetchResponse response) {
        String base = response.getUrl().toString();
        try {
            // charset 미지정이면 jsoup 이 meta charset 으로 판단
            return Jsoup.parse(new ByteArrayInputStream(response.getBody()), declaredCharset(response), base);
        } catch (IOException e) {
            throw new ContentParseException("unreadable HTML body", base, e);
        }
    }

    private static String declaredCharset(FetchResponse response) {
        String ct = response.header("Content-Type");
        if (ct == null) return null;
        for (String part : ct.split(";")) {
            String p = part.trim();
            if (p.regionMatches(true, 0, "charset=", 0, 8)) {
                String cs = p.substring(8).replace("\"", "").trim();
                return cs.isEmpty() ? null : cs;
            }
        }
        return null;
    }

    // ---------- metadata ----------
    static String firstText(Document doc, List<String> selectors, int max) {
        for (String sel : selectors) {
            for (Element el : doc.select(sel)) {
                String v = el.hasAttr("content") ? el.attr("content") : el.text();
                v = TextUtils.blankToNull(v);
                if (v != null) return TextUtils.cap(v, max);
            }
        }
        return null;
    }

    static URI canonical(Document doc, URI base) {
        Element link = doc.selectFirst("link[rel=canonical][href]");
        return (link == null) ? null : UrlUtils.resolve(base, link.attr("href"));
    }

    static String declaredLanguage(Document doc) {
        Element html = doc.selectFirst("html[lang]");
        if (html != null) {
            String tag = LanguageDetector.primaryTag(html.attr("lang"));
            if (tag != null) return tag;
        }
        Element meta = doc.selectFirst("meta[http-equiv=content-language][content], meta[name=language][content]");
        return meta == null ? null : LanguageDetector.primaryTag(meta.attr("content"));
    }

    /** 구조화 메타 > time[datetime] > 본문 텍스트 휴리스틱 */
    static Instant published(Document doc, String mainText) {
        Optional<Instant> d = fromSelectors(doc, PUBLISHED_META);
        if (d.isEmpty()) d = fromJsonLd(doc, "datePublished");
        if (d.isEmpty()) d = fromSelectors(doc, List.of("time[datetime]", "[datetime]"));
        if (d.isEmpty()) {
            String text = (mainText != null) ? mainText : (doc.body() == null ? null : doc.body().text());
            if (text != null) d = DateParsing.findInText(TextUtils.cap(text, DATE_SCAN_CHARS));
        }
        return d.orElse(null);
    }

    static Instant lastModified(Document doc, String lastModifiedHeader) {
        Optional<Instant> d = fromSelectors(doc, MODIFIED_META);
        if (d.isEmpty()) d = fromJsonLd(doc, "dateModified");
        if (d.isEmpty()) d = DateParsing.parse(lastModifiedHeader);
        return d.orElse(null);
    }

    private static Optional<Instant> fromSelectors(Document doc, List<String> selectors) {
        for (String sel : selectors) {
            for (Element el : doc.select(sel)) {
                String raw = el.hasAttr("content") ? el.attr("content")
                        : el.hasAttr("datetime") ? el.attr("datetime")
                        : el.text();
                Optional<Instant> d = DateParsing.parse(raw);
                if (d.isPresent()) return d;
            }
        }
        return Optional.empty();
    }

    private static Optional<Instant> fromJsonLd(Document doc, String field) {
        for (Element script : doc.select("script[type=application/ld+json]")) {
            try {
                JsonNode root = OM.readTree(script.data());
                Optional<Instant> d = findDate(root, field, 0);
                if (d.isPresent()) return d;
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
            }
        }
        return Optional.empty();
    }

    private static Optional<Instant> findDate(JsonNode node, String field, int depth) {
        if (node == null || depth > 4) return Optional.empty();
        if (node.isArray()) {
            for (JsonNode n : node) {
                Optional<Instant> d = findDate(n, field, depth + 1);
                if (d.isPresent()) return d;
            }
            return Optional.empty();
        }
        if (!node.isObject()) return Optional.empty();
        JsonNode v = node.get(field);
        if (v != null && v.isTextual()) {
            Optional<Instant> d = DateParsing.parse(v.asText());
            if (d.isPresent()) return d;
        }
        return findDate(node.get("@graph"), field, depth + 1);
    }

    private static void checkInterrupted(AnalysisContext ctx) {
        if (Thread.currentThread().isInterrupted()) {
            throw AnalysisException.timeout(ctx.url(), ctx.config().getTimeoutMs());
        }
    }
}
