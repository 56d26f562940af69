package com.pageanalyzer.core.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pageanalyzer.core.api.AnalysisContext;
import com.pageanalyzer.core.api.IContentAnalyzer;
import com.pageanalyzer.core.api.IFetcher;
import com.pageanalyzer.core.exception.ContentParseException;
import com.pageanalyzer.core.exception.FeedValidationException;
import com.pageanalyzer.core.exception.FetchException;
import com.pageanalyzer.core.lang.LanguageDetector;
import com.pageanalyzer.core.model.AnalysisConfig;
import com.pageanalyzer.core.model.AnalysisRecord;
import com.pageanalyzer.core.model.ContentSignals;
import com.pageanalyzer.core.model.ContentType;
import com.pageanalyzer.core.model.FeedDescriptor;
import com.pageanalyzer.core.model.FeedType;
import com.pageanalyzer.core.model.FetchResponse;
import com.pageanalyzer.core.util.DateParsing;
import com.pageanalyzer.core.util.TextUtils;
import com.pageanalyzer.core.util.UrlUtils;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * RSS(0.9x/1.0/2.0)/Atom 은 Rome, JSON Feed 는 Jackson 으로 파싱.
 * - parse: 바이트 → ParsedFeed (잘못된 입력은 ContentParseException)
 * - validate: fetch + parse → FeedDescriptor (피드가 아니면 FeedValidationException)
 * - analyze: 피드를 페이지 레코드로 렌더링
 */
public final class FeedAnalyzer implements IContentAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(FeedAnalyzer.class);
    private static final ObjectMapper OM = new ObjectMapper();

    static final int PAGE_ENTRIES = 10;
    static final int MAX_ENTRY_BODY = 500;
    static final int MAX_SUMMARY = 300;
    static final int SUMMARY_TITLES = 3;
    static final int MAX_TITLE = 200;
    static final int MAX_DESCRIPTION = 500;
    static final int MAX_LINKS = 50;

    private final LanguageDetector languageDetector;

    public FeedAnalyzer() {
        this(LanguageDetector.defaultDetector());
    }

    public FeedAnalyzer(LanguageDetector languageDetector) {
        this.languageDetector = languageDetector;
    }

    @Override
    public ContentType contentType() {
        return ContentType.FEED;
    }

    // =========================
    // parse
    // =========================

    public ParsedFeed parse(byte[] bytes, String url, int maxEntries) {
        if (bytes == null || bytes.length == 0) {
            throw new ContentParseException("empty feed body", url);
        }
        return looksLikeJson(bytes) ? parseJsonFeed(bytes, url, maxEntries) : parseXmlFeed(bytes, url, maxEntries);
    }

    private ParsedFeed parseXmlFeed(byte[] bytes, String url, int maxEntries) {
        SyndFeed sf;
        try {
            SyndFeedInput input = new SyndFeedInput();
            sf = input.build(new XmlReader(new ByteArrayInputStream(bytes)));
        } catch (FeedException | IOException | IllegalArgumentException e) {
            throw ContentParseException.malformedFeed(url, e);
        }

        String ft = sf.getFeedType() == null ? "" : sf.getFeedType().toLowerCase(Locale.ROOT);
        FeedType type = ft.startsWith("atom") ? FeedType.ATOM : FeedType.RSS;

        List<SyndEntry> all = sf.getEntries() == null ? List.of() : sf.getEntries();
        List<ParsedFeed.Entry> entries = new ArrayList<>();
        for (SyndEntry e : all) {
            if (entries.size() >= maxEntries) break;
            entries.add(new ParsedFeed.Entry(
                    TextUtils.blankToNull(e.getTitle()),
                    TextUtils.blankToNull(e.getLink()),
                    entryBody(e),
                    toInstant(e.getPublishedDate() != null ? e.getPublishedDate() : e.getUpdatedDate())));
        }
        return new ParsedFeed(type,
                TextUtils.blankToNull(sf.getTitle()),
                TextUtils.blankToNull(TextUtils.stripTags(sf.getDescription())),
                TextUtils.blankToNull(sf.getLink()),
                LanguageDetector.primaryTag(sf.getLanguage()),
                toInstant(sf.getPublishedDate()),
                entries,
                all.size());
    }

    private static String entryBody(SyndEntry e) {
        if (e.getContents() != null) {
            for (SyndContent c : e.getContents()) {
                String v = TextUtils.blankToNull(TextUtils.stripTags(c.getValue()));
                if (v != null) return v;
            }
        }
        return e.getDescription() == null ? null : TextUtils.blankToNull(TextUtils.stripTags(e.getDescription().getValue()));
    }

    private ParsedFeed parseJsonFeed(byte[] bytes, String url, int maxEntries) {
        JsonNode root;
        try {
            root = OM.readTree(bytes);
        } catch (IOException e) {
            throw ContentParseException.malformedJson(url, e);
        }
        if (root == null || !root.isObject() || !root.path("version").asText("").contains("jsonfeed.org")) {
            throw new ContentParseException("not a JSON Feed document", url);
        }

        JsonNode items = root.path("items");
        List<ParsedFeed.Entry> entries = new ArrayList<>();
        int total = items.isArray() ? items.size() : 0;
        if (items.isArray()) {
            for (JsonNode it : items) {
                if (entries.size() >= maxEntries) break;
                String body = text(it, "content_text");
                if (body == null) body = TextUtils.blankToNull(TextUtils.stripTags(text(it, "content_html")));
                if (body == null) body = text(it, "summary");
                String date = text(it, "date_published");
                if (date == null) date = text(it, "date_modified");
                String link = text(it, "url");
                if (link == null) link = text(it, "external_url");
                entries.add(new ParsedFeed.Entry(text(it, "title"), link, body,
                        DateParsing.parse(date).orElse(null)));
            }
        }
        return new ParsedFeed(FeedType.JSON,
                text(root, "title"),
                text(root, "description"),
                text(root, "home_page_url"),
                LanguageDetector.primaryTag(text(root, "language")),
                null,
                entries,
                total);
    }

    // =========================
    // validate
    // =========================

    /** fetch + parse + 활성 여부 판정. 피드가 아니면 FeedValidationException */
    public FeedDescriptor validate(URI feedUrl, IFetcher fetcher, AnalysisConfig cfg, Instant now) throws FetchException {
        FetchResponse resp = fetcher.fetch(feedUrl, cfg.getTimeout());
        if (resp.isHttpError()) {
            throw FeedValidationException.httpStatus(feedUrl.toString(), resp.getStatusCode());
        }
        resp = resp.truncate(cfg.getMaxContentBytes());
        try {
            ParsedFeed feed = parse(resp.getBody(), feedUrl.toString(), cfg.getMaxFeedEntries());
            return describe(feedUrl, feed, cfg, now);
        } catch (ContentParseException e) {
            throw FeedValidationException.notAFeed(feedUrl.toString(), e);
        }
    }

    public FeedDescriptor describe(URI feedUrl, ParsedFeed feed, AnalysisConfig cfg, Instant now) {
        Instant updated = feed.lastUpdated() != null ? feed.lastUpdated() : feed.newestEntryDate();
        return FeedDescriptor.builder()
                .url(feedUrl)
                .title(TextUtils.cap(feed.title(), MAX_TITLE))
                .description(TextUtils.cap(feed.description(), MAX_DESCRIPTION))
                .feedType(feed.feedType())
                .lastUpdated(updated)
                .entryCount(feed.entries().size())
                .active(isActive(feed.entryDates(), now, cfg.getFeedActivityWindowDays()))
                .language(feed.language())
                .build();
    }

    /**
     * 활성 판정:
     *  - 활동 창(windowDays) 안에 게시된 엔트리가 하나라도 있거나
     *  - 날짜 있는 엔트리 3개 이상, 간격 변동계수 0.5 이하, 최신 엔트리가 평균 간격의 2배 이내
     */
    public static boolean isActive(List<Instant> dates, Instant now, int windowDays) {
        if (dates == null || dates.isEmpty() || now == null) return false;

        Instant windowStart = now.minus(Duration.ofDays(Math.max(0, windowDays)));
        for (Instant d : dates) {
            if (!d.isBefore(windowStart)) return true;
        }
        if (dates.size() < 3) return false;

        List<Instant> sorted = new ArrayList<>(dates);
        sorted.sort(Comparator.reverseOrder());
        double[] gaps = new double[sorted.size() - 1];
        double sum = 0;
        for (int i = 0; i < gaps.length; i++) {
            gaps[i] = Duration.between(sorted.get(i + 1), sorted.get(i)).getSeconds();
            sum += gaps[i];
        }
        double mean = sum / gaps.length;
        if (mean <= 0) return false;
        double var = 0;
        for (double g : gaps) var += (g - mean) * (g - mean);
        double cv = Math.sqrt(var / gaps.length) / mean;

        double newestAge = Duration.between(sorted.get(0), now).getSeconds();
        return cv <= 0.5 && newestAge <= 2 * mean;
    }

    // =========================
    // analyze (피드 → 페이지 레코드)
    // =========================

    @Override
    public AnalysisRecord.Builder analyze(FetchResponse response, AnalysisContext ctx) {
        AnalysisConfig cfg = ctx.config();
        ParsedFeed feed = parse(response.getBody(), ctx.url(), cfg.getMaxFeedEntries());
        log.debug("Parsed {} feed {} with {} entries", feed.feedType().wireName(), ctx.url(), feed.entries().size());

        String content = renderEntries(feed.entries());
        if (content == null) content = feed.description();

        AnalysisRecord.Builder b = AnalysisRecord.builder()
                .url(ctx.url())
                .resolvedContentType(ContentType.FEED)
                .title(TextUtils.cap(feed.title(), MAX_TITLE))
                .description(TextUtils.cap(feed.description(), MAX_DESCRIPTION))
                .mainContent(content)
                .summary(summarize(feed.entries()))
                .publishedAt(feed.newestEntryDate())
                .lastModifiedAt(feed.lastUpdated())
                .language(feed.language());
        ctx.checkpoint(b);

        double langConfidence = 0.0;
        if (feed.language() != null) {
            langConfidence = 0.5;
        } else if (cfg.isDetectLanguage() && languageDetector != null) {
            Optional<LanguageDetector.Detection> d = languageDetector.detect(content);
            if (d.isPresent()) {
                b.language(d.get().language());
                langConfidence = d.get().confidence();
            }
        }
        b.signals(new ContentSignals(0.0, langConfidence, true, feed.bodylessRatio()));

        if (cfg.isExtractLinks()) {
            b.externalLinks(entryLinks(feed, response.getUrl()));
        }
        ctx.checkpoint(b);
        return b;
    }

    /** 앞 10개 엔트리: "Title: ..." + 본문(500자) */
    static String renderEntries(List<ParsedFeed.Entry> entries) {
        List<String> parts = new ArrayList<>();
        for (ParsedFeed.Entry e : entries.subList(0, Math.min(PAGE_ENTRIES, entries.size()))) {
            if (e.title() != null) parts.add("Title: " + e.title());
            if (e.hasBody()) parts.add(TextUtils.cap(e.content(), MAX_ENTRY_BODY));
        }
        return parts.isEmpty() ? null : String.join("\n\n", parts);
    }

    /** "Recent entries: t1; t2; t3" (300자 상한) */
    static String summarize(List<ParsedFeed.Entry> entries) {
        List<String> titles = new ArrayList<>();
        for (ParsedFeed.Entry e : entries) {
            if (titles.size() >= SUMMARY_TITLES) break;
            if (e.title() != null) titles.add(e.title());
        }
        if (titles.isEmpty()) return null;
        return TextUtils.cap("Recent entries: " + String.join("; ", titles), MAX_SUMMARY);
    }

    private static List<URI> entryLinks(ParsedFeed feed, URI base) {
        Map<String, URI> out = new LinkedHashMap<>();
        for (ParsedFeed.Entry e : feed.entries()) {
            if (out.size() >= MAX_LINKS) break;
            URI u = UrlUtils.resolve(base, e.link());
            if (u != null) out.putIfAbsent(UrlUtils.dedupeKey(u), u);
        }
        return new ArrayList<>(out.values());
    }

    // ---------- helpers ----------
    private static boolean looksLikeJson(byte[] bytes) {
        for (int i = 0; i < bytes.length; i++) {
            int c = bytes[i] & 0xFF;
            if (c == 0xEF || c == 0xBB || c == 0xBF) continue; // UTF-8 BOM
            if (Character.isWhitespace(c)) continue;
            return c == '{';
        }
        return false;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return (v == null || v.isNull() || !v.isValueNode()) ? null : TextUtils.blankToNull(v.asText());
    }

    private static Instant toInstant(Date d) {
        return d == null ? null : d.toInstant();
    }
}
