package com.pageanalyzer.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + same-origin 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = (u.getPath() == null || u.getPath().isEmpty()) ? "/" : u.getPath();
        path = path.replaceAll("/{2,}", "/");

        String query = u.getQuery();

        try {
            return new URI(scheme, null, host, port, path, query, null);
        } catch (URISyntaxException e) {
            return u;
        }
    }

    /**
     * 문자열 URL 파싱 + 절대 http(s) 검증. 실패 시 null.
     * 공백은 %20 으로 치환해 관대하게 받는다.
     */
    public static URI parseHttp(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI u = new URI(raw.trim().replace(" ", "%20"));
            return isHttp(u) ? u : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** base 기준 상대 href 해석. 절대 http(s) 가 아니면 null */
    public static URI resolve(URI base, String href) {
        if (href == null) return null;
        String h = href.trim();
        if (h.isEmpty() || h.startsWith("#")) return null;
        String lower = h.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("mailto:")
                || lower.startsWith("tel:") || lower.startsWith("data:")) return null;
        try {
            URI ref = new URI(h.replace(" ", "%20"));
            URI abs = (base == null || ref.isAbsolute()) ? ref : base.resolve(ref);
            if (!isHttp(abs)) return null;
            return stripFragment(abs);
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    public static boolean isHttp(URI u) {
        if (u == null || u.getScheme() == null || u.getHost() == null) return false;
        String s = u.getScheme().toLowerCase(Locale.ROOT);
        return s.equals("http") || s.equals("https");
    }

    /** host 기준 동일 사이트 판정(소문자 비교, www. 무시) */
    public static boolean sameDomain(URI a, URI b) {
        if (a == null || b == null) return false;
        return bareHost(a).equals(bareHost(b));
    }

    /** 중복 제거 키: 정규화 + www. 제거 + 끝 슬래시 제거 */
    public static String dedupeKey(URI u) {
        URI n = normalize(u);
        if (n == null) return "";
        String s = n.toString();
        if (n.getHost() != null && n.getHost().startsWith("www.")) s = s.replaceFirst("://www\\.", "://");
        if (s.endsWith("/") && n.getQuery() == null) s = s.substring(0, s.length() - 1);
        return s;
    }

    private static String bareHost(URI u) {
        String h = u.getHost() == null ? "" : u.getHost().toLowerCase(Locale.ROOT);
        return h.startsWith("www.") ? h.substring(4) : h;
    }

    private static URI stripFragment(URI u) throws URISyntaxException {
        if (u.getRawFragment() == null) return u;
        String s = u.toString();
        return new URI(s.substring(0, s.indexOf('#')));
    }
}
