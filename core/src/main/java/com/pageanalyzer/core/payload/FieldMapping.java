package com.pageanalyzer.core.payload;

import com.pageanalyzer.core.util.TextUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 임의 레코드 → 공통 스키마(title/content/url/date/id) 매핑.
 * 필드명은 대소문자/밑줄/하이픈 무시 비교 (publishedAt == published_at).
 * 매핑되지 않은 필드는 버리지 않고 "metadata" 아래에 보존한다.
 */
public final class FieldMapping {
    private FieldMapping() {}

    public static final String TITLE = "title";
    public static final String CONTENT = "content";
    public static final String URL = "url";
    public static final String DATE = "date";
    public static final String ID = "id";
    public static final String METADATA = "metadata";

    /** 목표 필드 → 후보 이름 (우선순위 순) */
    private static final Map<String, List<String>> ALIASES = new LinkedHashMap<>();
    static {
        ALIASES.put(TITLE, List.of("title", "name", "headline", "subject"));
        ALIASES.put(CONTENT, List.of("body", "content", "description", "text"));
        ALIASES.put(URL, List.of("url", "link", "href", "permalink"));
        ALIASES.put(DATE, List.of("date", "published_at", "created", "created_at", "updated_at", "timestamp"));
        ALIASES.put(ID, List.of("id", "uuid", "guid"));
    }

    /** 중첩 객체에서 문자열을 꺼낼 때 보는 키 (WordPress "rendered" 등) */
    private static final List<String> NESTED_TEXT_KEYS = List.of("rendered", "value", "#text", "text", "href");

    public static Map<String, Object> normalize(Map<String, Object> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        Map<String, Object> metadata = new LinkedHashMap<>();
        Map<String, String> used = new LinkedHashMap<>(); // 원본 키 → 목표 필드

        for (Map.Entry<String, List<String>> target : ALIASES.entrySet()) {
            for (String alias : target.getValue()) {
                String key = findKey(raw, alias);
                if (key == null || used.containsKey(key)) continue;
                String v = asText(raw.get(key));
                if (v == null) continue;
                if (target.getKey().equals(CONTENT) || target.getKey().equals(TITLE)) v = TextUtils.stripTags(v);
                if (v == null || v.isBlank()) continue;
                out.put(target.getKey(), v);
                used.put(key, target.getKey());
                break;
            }
        }
        for (Map.Entry<String, Object> e : raw.entrySet()) {
            if (!used.containsKey(e.getKey())) metadata.put(e.getKey(), e.getValue());
        }
        if (!metadata.isEmpty()) out.put(METADATA, metadata);
        return out;
    }

    /** title + content 가 모두 매핑되었는지 */
    public static boolean isComplete(Map<String, Object> normalized) {
        return normalized.get(TITLE) != null && normalized.get(CONTENT) != null;
    }

    static String canon(String k) {
        return k.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }

    private static String findKey(Map<String, Object> raw, String alias) {
        String want = canon(alias);
        for (String k : raw.keySet()) {
            if (k != null && canon(k).equals(want)) return k;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static String asText(Object v) {
        if (v == null) return null;
        if (v instanceof String s) return TextUtils.blankToNull(s);
        if (v instanceof Number || v instanceof Boolean) return String.valueOf(v);
        if (v instanceof Map<?, ?> m) {
            for (String k : NESTED_TEXT_KEYS) {
                Object inner = ((Map<String, Object>) m).get(k);
                if (inner instanceof String s && !s.isBlank()) return s.trim();
            }
        }
        return null;
    }
}
