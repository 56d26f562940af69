package com.pageanalyzer.core.payload;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 알려진 API 스키마 판별. 맞는 게 없으면 empty (추측하지 않음).
 * 힌트는 알려진 스키마 이름이고 페이로드가 실제로 만족할 때만 채택한다.
 */
public final class SchemaDetector {
    private SchemaDetector() {}

    public static final String JSONAPI = "jsonapi";
    public static final String HAL = "hal";
    public static final String ELASTICSEARCH = "elasticsearch";
    public static final String ODATA = "odata";
    public static final String JSON_LD = "json-ld";
    public static final String KIND_ITEMS = "kind-items";
    public static final String JSONFEED = "jsonfeed";

    /** 판별 순서 */
    public static final List<String> KNOWN = List.of(JSONAPI, HAL, ELASTICSEARCH, ODATA, JSON_LD, KIND_ITEMS, JSONFEED);

    public static Optional<String> detect(JsonNode root, String hint) {
        if (root == null || !root.isObject()) return Optional.empty();

        String h = canonicalHint(hint);
        if (h != null && matches(h, root)) return Optional.of(h);

        for (String schema : KNOWN) {
            if (matches(schema, root)) return Optional.of(schema);
        }
        return Optional.empty();
    }

    /** "JSON:API", "json_api" → "jsonapi" 식 정규화. 모르는 이름이면 null */
    static String canonicalHint(String hint) {
        if (hint == null || hint.isBlank()) return null;
        String h = hint.trim().toLowerCase(Locale.ROOT).replace(":", "").replace("_", "").replace("-", "").replace(" ", "");
        return switch (h) {
            case "jsonapi" -> JSONAPI;
            case "hal", "haljson" -> HAL;
            case "elasticsearch", "es", "opensearch" -> ELASTICSEARCH;
            case "odata" -> ODATA;
            case "jsonld", "schemaorg" -> JSON_LD;
            case "kinditems", "google" -> KIND_ITEMS;
            case "jsonfeed" -> JSONFEED;
            default -> null;
        };
    }

    static boolean matches(String schema, JsonNode root) {
        return switch (schema) {
            case JSONAPI -> isJsonApi(root);
            case HAL -> root.path("_embedded").isObject()
                    || (root.path("_links").isObject() && root.path("_links").has("self"));
            case ELASTICSEARCH -> isElasticsearch(root);
            case ODATA -> hasKeyPrefix(root, "@odata.") || root.has("odata.metadata");
            case JSON_LD -> root.has("@context") && (root.has("@type") || root.path("@graph").isArray());
            case KIND_ITEMS -> root.path("kind").isTextual() && root.path("items").isArray();
            case JSONFEED -> root.path("version").asText("").contains("jsonfeed.org") && root.path("items").isArray();
            default -> false;
        };
    }

    private static boolean isJsonApi(JsonNode root) {
        JsonNode data = root.get("data");
        if (data == null) return false;
        JsonNode first = data.isArray() ? (data.size() > 0 ? data.get(0) : null) : data;
        return first != null && first.isObject()
                && first.path("type").isTextual()
                && first.path("attributes").isObject();
    }

    private static boolean isElasticsearch(JsonNode root) {
        JsonNode hits = root.path("hits").path("hits");
        if (!hits.isArray()) return false;
        return hits.size() == 0 || hits.get(0).has("_source");
    }

    private static boolean hasKeyPrefix(JsonNode root, String prefix) {
        Iterator<String> it = root.fieldNames();
        while (it.hasNext()) {
            if (it.next().startsWith(prefix)) return true;
        }
        return false;
    }
}
