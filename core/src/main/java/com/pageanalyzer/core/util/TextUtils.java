package com.pageanalyzer.core.util;

import org.jsoup.Jsoup;

/** 텍스트 정리/자르기 유틸 */
public final class TextUtils {
    private TextUtils() {}

    /** 연속 공백 → 공백 1개, 앞뒤 trim. null → null */
    public static String squash(String s) {
        if (s == null) return null;
        return s.replaceAll("[\\s\\u00A0]+", " ").trim();
    }

    /** squash 후 비면 null */
    public static String blankToNull(String s) {
        String t = squash(s);
        return (t == null || t.isEmpty()) ? null : t;
    }

    /** 최대 max 글자 (단순 절단) */
    public static String cap(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * 최대 max 글자, 단어 경계에서 자름.
     * 경계가 앞쪽 절반보다 앞에 있으면 그냥 max 에서 자른다.
     */
    public static String cutAtWord(String s, int max) {
        if (s == null) return null;
        if (s.length() <= max) return s;
        int cut = s.lastIndexOf(' ', max);
        if (cut < max / 2) cut = max;
        return s.substring(0, cut).trim();
    }

    /** HTML 조각의 태그 제거 + 공백 정리 */
    public static String stripTags(String html) {
        if (html == null || html.isEmpty()) return html;
        if (html.indexOf('<') < 0 && html.indexOf('&') < 0) return squash(html);
        return squash(Jsoup.parseBodyFragment(html).text());
    }
}
