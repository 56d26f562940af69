package com.pageanalyzer.core.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pageanalyzer.core.api.AnalysisContext;
import com.pageanalyzer.core.api.IContentAnalyzer;
import com.pageanalyzer.core.exception.ContentParseException;
import com.pageanalyzer.core.lang.LanguageDetector;
import com.pageanalyzer.core.model.AnalysisConfig;
import com.pageanalyzer.core.model.AnalysisRecord;
import com.pageanalyzer.core.model.ApiAnalysisRecord;
import com.pageanalyzer.core.model.ContentSignals;
import com.pageanalyzer.core.model.ContentType;
import com.pageanalyzer.core.model.FetchResponse;
import com.pageanalyzer.core.util.DateParsing;
import com.pageanalyzer.core.util.TextUtils;
import com.pageanalyzer.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 임의 JSON/XML 페이로드 분석.
 * 1) 최상위 모양 판별(detectStructure)
 * 2) 알려진 스키마 판별(SchemaDetector)
 * 3) 컨테이너를 따라 레코드 추출 + 공통 필드 매핑(FieldMapping)
 */
public final class ApiAnalyzer implements IContentAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ApiAnalyzer.class);
    private static final ObjectMapper OM = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static final int MAX_RECORDS = 100;
    static final int PAGE_RECORDS = 20;
    static final int MAX_TITLE = 200;
    static final int MAX_DESCRIPTION = 500;
    static final int MAX_SUMMARY = 300;
    static final int SUMMARY_TITLES = 3;
    static final int MAX_LINKS = 50;

    /** 배열 컨테이너 후보 키 (우선순위 순) */
    static final List<String> CONTAINER_KEYS = List.of(
            "data", "items", "results", "entries", "records", "posts", "articles",
            "hits", "value", "docs", "rows", "list", "content", "objects", "children");

    /** canon() 기준 비교 */
    static final Set<String> PAGINATION_KEYS = Set.of(
            "page", "perpage", "pagesize", "pagenumber", "total", "totalcount", "totalpages", "totalresults",
            "count", "next", "nextpage", "previous", "prev", "cursor", "nextcursor", "offset", "limit",
            "hasmore", "meta", "links", "pagination", "paging", "nextpagetoken", "@odata.nextlink", "@odata.count");

    private static final List<String> ROOT_TITLE_KEYS = List.of("title", "name", "api_name", "service_name");
    private static final List<String> ROOT_DESCRIPTION_KEYS = List.of("description", "summary", "about");

    private final LanguageDetector languageDetector;

    public ApiAnalyzer() {
        this(LanguageDetector.defaultDetector());
    }

    public ApiAnalyzer(LanguageDetector languageDetector) {
        this.languageDetector = languageDetector;
    }

    @Override
    public ContentType contentType() {
        return ContentType.API;
    }

    // =========================
    // 페이로드 분석
    // =========================

    /**
     * 원문 페이로드 분석. 실패는 예외 대신 errorMessage 가 채워진 레코드로 돌려준다.
     * 빈 입력은 오류가 아니라 "empty" 구조.
     */
    public ApiAnalysisRecord analyzePayload(String endpointUrl, String rawPayload, String schemaHint) {
        return analyzeInternal(endpointUrl, rawPayload, schemaHint).result();
    }

    /** 분석 결과 + 파싱된 JSON 루트 (XML/빈 입력/오류면 root 는 null) */
    private record Analysis(ApiAnalysisRecord result, JsonNode root) {}

    private Analysis analyzeInternal(String endpointUrl, String rawPayload, String schemaHint) {
        long t0 = System.nanoTime();
        String url = Objects.requireNonNullElse(endpointUrl, "");
        String raw = stripBom(rawPayload);

        if (raw == null || raw.isBlank()) {
            return new Analysis(new ApiAnalysisRecord(url, DetectedStructure.of(DetectedStructure.Kind.EMPTY).describe(),
                    List.of(), null, 0.0, elapsedMs(t0), null), null);
        }
        if (raw.strip().startsWith("<")) {
            return new Analysis(analyzeXml(url, raw, t0), null);
        }

        JsonNode root;
        try {
            root = OM.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Malformed JSON payload from {}: {}", url, e.getOriginalMessage());
            return new Analysis(ApiAnalysisRecord.error(url, ContentParseException.malformedJson(url, e).getMessage(), elapsedMs(t0)), null);
        }
        return new Analysis(analyzeJson(url, root, schemaHint, t0), root);
    }

    private ApiAnalysisRecord analyzeJson(String url, JsonNode root, String schemaHint, long t0) {
        DetectedStructure structure = detectStructure(root);
        if (structure.kind() == DetectedStructure.Kind.ERROR_ENVELOPE) {
            return new ApiAnalysisRecord(url, structure.describe(), List.of(), null, 0.0, elapsedMs(t0),
                    "API error response: " + errorMessageOf(root));
        }

        String schema = SchemaDetector.detect(root, schemaHint).orElse(null);
        List<Map<String, Object>> records = extractRecords(root, structure, schema);
        log.debug("API payload {} structure={} schema={} records={}", url, structure.describe(), schema, records.size());
        return new ApiAnalysisRecord(url, structure.describe(), records, schema, dataQuality(records), elapsedMs(t0), null);
    }

    /** 최상위 모양 분류 */
    public DetectedStructure detectStructure(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return DetectedStructure.of(DetectedStructure.Kind.EMPTY);
        }
        if (root.isArray()) {
            if (root.isEmpty()) return DetectedStructure.of(DetectedStructure.Kind.EMPTY);
            for (JsonNode n : root) {
                if (n.isObject()) return DetectedStructure.of(DetectedStructure.Kind.ARRAY_OF_OBJECTS);
            }
            return DetectedStructure.of(DetectedStructure.Kind.SCALAR);
        }
        if (!root.isObject()) {
            return (root.isTextual() && root.asText().isBlank())
                    ? DetectedStructure.of(DetectedStructure.Kind.EMPTY)
                    : DetectedStructure.of(DetectedStructure.Kind.SCALAR);
        }
        if (root.isEmpty()) return DetectedStructure.of(DetectedStructure.Kind.EMPTY);

        String container = findContainer(root);
        if (container != null) {
            DetectedStructure.Kind kind = hasPagination(root)
                    ? DetectedStructure.Kind.PAGINATED_ENVELOPE
                    : DetectedStructure.Kind.WRAPPED_ARRAY;
            return new DetectedStructure(kind, container);
        }
        if (isErrorEnvelope(root)) return DetectedStructure.of(DetectedStructure.Kind.ERROR_ENVELOPE);
        return DetectedStructure.of(DetectedStructure.Kind.SINGLE_OBJECT);
    }

    /**
     * 구조를 따라 레코드 추출 (최대 100개).
     * 스키마가 있으면 스키마 고유의 감싸기(JSON:API attributes, ES _source)를 먼저 벗긴다.
     */
    public List<Map<String, Object>> extractRecords(JsonNode root, DetectedStructure structure, String schema) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (root == null) return out;

        if (SchemaDetector.JSONAPI.equals(schema)) {
            for (JsonNode n : asList(root.get("data"))) addRecord(out, jsonApiResource(n));
            return out;
        }
        if (SchemaDetector.ELASTICSEARCH.equals(schema)) {
            for (JsonNode hit : root.path("hits").path("hits")) addRecord(out, elasticsearchHit(hit));
            return out;
        }
        if (SchemaDetector.JSON_LD.equals(schema) && root.path("@graph").isArray()) {
            for (JsonNode n : root.get("@graph")) addRecord(out, toMap(n));
            return out;
        }

        switch (structure.kind()) {
            case ARRAY_OF_OBJECTS -> {
                for (JsonNode n : root) addRecord(out, elementRecord(n));
            }
            case WRAPPED_ARRAY, PAGINATED_ENVELOPE -> {
                for (JsonNode n : at(root, structure.containerKey())) {
                    Map<String, Object> rec = elementRecord(n);
                    if (rec != null && SchemaDetector.JSONFEED.equals(schema)) rec = jsonFeedItem(rec);
                    addRecord(out, rec);
                }
            }
            case SINGLE_OBJECT -> addRecord(out, toMap(root));
            case SCALAR -> {
                if (root.isArray()) {
                    for (JsonNode n : root) addRecord(out, elementRecord(n));
                } else {
                    addRecord(out, elementRecord(root));
                }
            }
            default -> { /* EMPTY, ERROR_ENVELOPE, XML_DOCUMENT: 레코드 없음 */ }
        }
        return out;
    }

    /** title+content 를 모두 가진 레코드 비율 */
    public static double dataQuality(List<Map<String, Object>> records) {
        if (records == null || records.isEmpty()) return 0.0;
        long complete = records.stream().filter(FieldMapping::isComplete).count();
        return (double) complete / records.size();
    }

    // =========================
    // XML
    // =========================

    /** 가장 많이 반복되는(2회 이상) 자식 보유 요소를 레코드 컨테이너로 본다 */
    private ApiAnalysisRecord analyzeXml(String url, String raw, long t0) {
        Document doc = Jsoup.parse(raw, url, Parser.xmlParser());
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Element el : doc.getAllElements()) {
            if (el == doc || el.children().isEmpty()) continue;
            counts.merge(el.tagName(), 1, Integer::sum);
        }
        String repeated = null;
        int best = 1;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                repeated = e.getKey();
            }
        }

        List<Map<String, Object>> records = new ArrayList<>();
        if (repeated != null) {
            for (Element el : doc.getElementsByTag(repeated)) addRecord(records, elementMap(el));
        } else {
            Element top = doc.children().isEmpty() ? null : doc.child(0);
            if (top != null) addRecord(records, elementMap(top));
        }
        DetectedStructure structure = new DetectedStructure(DetectedStructure.Kind.XML_DOCUMENT, repeated);
        return new ApiAnalysisRecord(url, structure.describe(), records, null, dataQuality(records), elapsedMs(t0), null);
    }

    /** 자식 요소 이름 → 텍스트 (같은 이름은 첫 번째만), 속성은 그대로 */
    private static Map<String, Object> elementMap(Element el) {
        Map<String, Object> raw = new LinkedHashMap<>();
        for (Attribute a : el.attributes()) raw.put(a.getKey(), a.getValue());
        for (Element child : el.children()) {
            String name = child.tagName();
            int colon = name.indexOf(':');
            if (colon >= 0) name = name.substring(colon + 1);
            String text = TextUtils.blankToNull(child.text());
            if (text == null && child.hasAttr("href")) text = child.attr("href");
            if (text != null) raw.putIfAbsent(name, text);
        }
        if (raw.isEmpty()) {
            String text = TextUtils.blankToNull(el.ownText());
            if (text != null) raw.put(FieldMapping.CONTENT, text);
        }
        return raw;
    }

    // =========================
    // IContentAnalyzer (페이로드 → 페이지 레코드)
    // =========================

    @Override
    public AnalysisRecord.Builder analyze(FetchResponse response, AnalysisContext ctx) {
        AnalysisConfig cfg = ctx.config();
        Analysis analysis = analyzeInternal(ctx.url(), response.bodyAsString(), null);
        ApiAnalysisRecord api = analysis.result();
        if (api.isError()) {
            throw new ContentParseException(api.getErrorMessage(), ctx.url());
        }

        JsonNode root = analysis.root();
        List<Map<String, Object>> records = api.getExtractedRecords();
        String content = renderRecords(records);

        AnalysisRecord.Builder b = AnalysisRecord.builder()
                .url(ctx.url())
                .resolvedContentType(ContentType.API)
                .title(pageTitle(root, records))
                .description(pageDescription(root, records))
                .mainContent(content)
                .summary(summarize(records))
                .publishedAt(newestDate(records));
        ctx.checkpoint(b);

        double langConfidence = 0.0;
        if (cfg.isDetectLanguage() && languageDetector != null && content != null) {
            Optional<LanguageDetector.Detection> d = languageDetector.detect(content);
            if (d.isPresent()) {
                b.language(d.get().language());
                langConfidence = d.get().confidence();
            }
        }
        boolean structured = api.getDetectedSchema() != null || api.getDetectedStructure().contains("(");
        b.signals(new ContentSignals(0.0, langConfidence, structured, bodylessRatio(records)));

        if (cfg.isExtractLinks()) {
            b.externalLinks(recordLinks(records, response.getUrl()));
        }
        ctx.checkpoint(b);
        return b;
    }

    /** 루트 title/name 계열 → "API Data: 첫 레코드 제목" → "API Response (N items)" */
    static String pageTitle(JsonNode root, List<Map<String, Object>> records) {
        String t = rootText(root, ROOT_TITLE_KEYS);
        if (t != null) return TextUtils.cap(t, MAX_TITLE);
        if (!records.isEmpty() && records.get(0).get(FieldMapping.TITLE) != null) {
            return TextUtils.cap("API Data: " + records.get(0).get(FieldMapping.TITLE), MAX_TITLE);
        }
        return "API Response (" + records.size() + " items)";
    }

    static String pageDescription(JsonNode root, List<Map<String, Object>> records) {
        String d = rootText(root, ROOT_DESCRIPTION_KEYS);
        if (d != null) return TextUtils.cap(d, MAX_DESCRIPTION);
        return records.isEmpty() ? null : "Structured API data containing " + records.size() + " items";
    }

    /** 앞 20개 레코드: "Title: ..\nContent: ..\nURL: .." 를 "---" 로 구분 */
    static String renderRecords(List<Map<String, Object>> records) {
        List<String> blocks = new ArrayList<>();
        for (Map<String, Object> r : records.subList(0, Math.min(PAGE_RECORDS, records.size()))) {
            List<String> lines = new ArrayList<>();
            if (r.get(FieldMapping.TITLE) != null) lines.add("Title: " + r.get(FieldMapping.TITLE));
            if (r.get(FieldMapping.CONTENT) != null) lines.add("Content: " + r.get(FieldMapping.CONTENT));
            if (r.get(FieldMapping.URL) != null) lines.add("URL: " + r.get(FieldMapping.URL));
            if (!lines.isEmpty()) blocks.add(String.join("\n", lines));
        }
        return blocks.isEmpty() ? null : String.join("\n\n---\n\n", blocks);
    }

    static String summarize(List<Map<String, Object>> records) {
        if (records.isEmpty()) return null;
        List<String> titles = new ArrayList<>();
        for (Map<String, Object> r : records) {
            if (titles.size() >= SUMMARY_TITLES) break;
            Object t = r.get(FieldMapping.TITLE);
            if (t != null) titles.add(t.toString());
        }
        if (titles.isEmpty()) return "API response with " + records.size() + " structured data items";
        return TextUtils.cap("API contains " + records.size() + " items. Recent: " + String.join("; ", titles), MAX_SUMMARY);
    }

    // ---------- 컨테이너 탐색 ----------

    /** "data" 같은 1단계 키 또는 "hits.hits" / "_embedded.orders" 같은 2단계 경로 */
    static String findContainer(JsonNode root) {
        for (String key : CONTAINER_KEYS) {
            JsonNode v = root.get(key);
            if (v == null) continue;
            if (v.isArray()) return key;
            if (v.isObject()) {
                for (String inner : CONTAINER_KEYS) {
                    if (v.path(inner).isArray()) return key + "." + inner;
                }
            }
        }
        JsonNode embedded = root.get("_embedded");
        if (embedded != null && embedded.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = embedded.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (e.getValue().isArray()) return "_embedded." + e.getKey();
            }
        }
        return null;
    }

    private static boolean hasPagination(JsonNode root) {
        Iterator<String> it = root.fieldNames();
        while (it.hasNext()) {
            if (PAGINATION_KEYS.contains(FieldMapping.canon(it.next()))) return true;
        }
        return false;
    }

    private static boolean isErrorEnvelope(JsonNode root) {
        JsonNode error = root.get("error");
        if (error != null && !error.isNull() && !(error.isBoolean() && !error.asBoolean())) return true;
        JsonNode errors = root.get("errors");
        if (errors != null && !errors.isNull()) {
            if (errors.isContainerNode() ? !errors.isEmpty() : !errors.asText().isBlank()) return true;
        }
        return root.path("message").isTextual()
                && (root.has("code") || root.has("status") || root.has("statusCode"));
    }

    static String errorMessageOf(JsonNode root) {
        JsonNode error = root.get("error");
        if (error != null) {
            if (error.isTextual()) return error.asText();
            String m = firstText(error, "message", "detail", "title");
            if (m != null) return m;
        }
        JsonNode errors = root.get("errors");
        if (errors != null && errors.isArray() && !errors.isEmpty()) {
            JsonNode first = errors.get(0);
            if (first.isTextual()) return first.asText();
            String m = firstText(first, "message", "detail", "title");
            if (m != null) return m;
        }
        String m = firstText(root, "message");
        return m != null ? m : "unknown error";
    }

    private static JsonNode at(JsonNode root, String dottedPath) {
        JsonNode cur = root;
        if (dottedPath == null) return cur;
        for (String seg : dottedPath.split("\\.")) cur = cur.path(seg);
        return cur;
    }

    // ---------- 스키마별 레코드 ----------

    private static Map<String, Object> jsonApiResource(JsonNode n) {
        if (n == null || !n.isObject()) return null;
        Map<String, Object> raw = toMap(n.path("attributes"));
        if (raw == null) raw = new LinkedHashMap<>();
        if (n.hasNonNull("id")) raw.putIfAbsent("id", n.get("id").asText());
        if (n.hasNonNull("type")) raw.putIfAbsent("type", n.get("type").asText());
        String self = n.path("links").path("self").isTextual() ? n.path("links").path("self").asText() : null;
        if (self != null) raw.putIfAbsent("url", self);
        return raw;
    }

    private static Map<String, Object> elasticsearchHit(JsonNode hit) {
        Map<String, Object> raw = toMap(hit.path("_source"));
        if (raw == null) return null;
        if (hit.hasNonNull("_id")) raw.putIfAbsent("id", hit.get("_id").asText());
        return raw;
    }

    private static Map<String, Object> jsonFeedItem(Map<String, Object> raw) {
        if (!raw.containsKey("content") && !raw.containsKey("body")) {
            Object body = raw.containsKey("content_text") ? raw.remove("content_text") : raw.remove("content_html");
            if (body != null) raw.put("body", body);
        }
        return raw;
    }

    // ---------- helpers ----------

    private static Map<String, Object> elementRecord(JsonNode n) {
        if (n == null) return null;
        if (n.isObject()) return toMap(n);
        if (n.isValueNode() && !n.isNull()) {
            String text = TextUtils.blankToNull(n.asText());
            if (text == null) return null;
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put(FieldMapping.CONTENT, text);
            return raw;
        }
        return null;
    }

    private static void addRecord(List<Map<String, Object>> out, Map<String, Object> raw) {
        if (raw == null || raw.isEmpty() || out.size() >= MAX_RECORDS) return;
        out.add(FieldMapping.normalize(raw));
    }

    private static Map<String, Object> toMap(JsonNode n) {
        if (n == null || !n.isObject()) return null;
        return OM.convertValue(n, MAP_TYPE);
    }

    private static List<JsonNode> asList(JsonNode n) {
        List<JsonNode> out = new ArrayList<>();
        if (n == null || n.isNull()) return out;
        if (n.isArray()) n.forEach(out::add);
        else out.add(n);
        return out;
    }

    private static String rootText(JsonNode root, List<String> keys) {
        if (root == null || !root.isObject()) return null;
        for (String k : keys) {
            JsonNode v = root.get(k);
            if (v != null && v.isValueNode() && !v.isNull()) {
                String s = TextUtils.blankToNull(v.asText());
                if (s != null) return s;
            }
        }
        return null;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (v != null && v.isTextual() && !v.asText().isBlank()) return v.asText().trim();
        }
        return null;
    }

    private static Instant newestDate(List<Map<String, Object>> records) {
        Instant newest = null;
        for (Map<String, Object> r : records) {
            Object d = r.get(FieldMapping.DATE);
            if (d == null) continue;
            Instant i = DateParsing.parse(d.toString()).orElse(null);
            if (i != null && (newest == null || i.isAfter(newest))) newest = i;
        }
        return newest;
    }

    private static double bodylessRatio(List<Map<String, Object>> records) {
        if (records.isEmpty()) return 0.0;
        long bodyless = records.stream().filter(r -> r.get(FieldMapping.CONTENT) == null).count();
        return (double) bodyless / records.size();
    }

    private static List<URI> recordLinks(List<Map<String, Object>> records, URI base) {
        Map<String, URI> out = new LinkedHashMap<>();
        for (Map<String, Object> r : records) {
            if (out.size() >= MAX_LINKS) break;
            Object link = r.get(FieldMapping.URL);
            URI u = link == null ? null : UrlUtils.resolve(base, link.toString());
            if (u != null) out.putIfAbsent(UrlUtils.dedupeKey(u), u);
        }
        return new ArrayList<>(out.values());
    }

    private static String stripBom(String s) {
        if (s != null && !s.isEmpty() && s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
