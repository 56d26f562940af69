package com.pageanalyzer.core.resolve;

import com.pageanalyzer.core.model.ContentType;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 콘텐츠 타입 판정 (순수 함수, I/O 없음).
 *
 * 우선순위:
 *  1) 유효한 명시 힌트 (auto/모르는 값은 무시)
 *  2) URL 패턴 (feed/rss/atom 경로, /api/, /vN/, .json, format=json ...)
 *  3) 페이로드 스니핑 (앞부분 바이트)
 *  4) URL 이 비었고 페이로드도 없으면 unknown, URL 만 있으면 html
 */
public final class ContentTypeResolver {
    private ContentTypeResolver() {}

    /** 스니핑에 쓰는 앞부분 크기 */
    public static final int SNIFF_BYTES = 1024;

    private static final Pattern FEED_PATH = Pattern.compile(
            "(^|/)(feed|feeds|rss|atom)(/|$|\\.)|\\.(rss|atom)$|(^|/)(rss|atom|feed)\\.xml$");
    private static final Pattern FEED_QUERY = Pattern.compile(
            "(^|&)(format|type|output)=(rss|atom|feed)(&|$)|(^|&)feed=");
    private static final Pattern API_PATH = Pattern.compile(
            "(^|/)api(/|$)|(^|/)v\\d+(/|$)|\\.json$|(^|/)json(/|$)|(^|/)graphql(/|$)");
    private static final Pattern API_QUERY = Pattern.compile(
            "(^|&)(format|output|alt)=json(&|$)");

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    public static ContentType resolve(String url, String hint, byte[] sniffed) {
        Optional<ContentType> byHint = ContentType.fromHint(hint);
        if (byHint.isPresent()) return byHint.get();

        Optional<ContentType> byUrl = fromUrl(url);
        if (byUrl.isPresent()) return byUrl.get();

        if (sniffed != null) return sniff(sniffed);

        return (url == null || url.isBlank()) ? ContentType.UNKNOWN : ContentType.HTML;
    }

    /** URL 경로/쿼리만 보고 판정. 판단 불가면 empty */
    public static Optional<ContentType> fromUrl(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        String u = url.trim().toLowerCase(Locale.ROOT);

        int hash = u.indexOf('#');
        if (hash >= 0) u = u.substring(0, hash);
        String query = "";
        int q = u.indexOf('?');
        if (q >= 0) {
            query = u.substring(q + 1);
            u = u.substring(0, q);
        }
        // scheme://host 제거 → 경로만
        int schemeEnd = u.indexOf("://");
        String path = u;
        if (schemeEnd >= 0) {
            int slash = u.indexOf('/', schemeEnd + 3);
            path = (slash >= 0) ? u.substring(slash) : "/";
        }

        if (FEED_PATH.matcher(path).find() || FEED_QUERY.matcher(query).find()) return Optional.of(ContentType.FEED);
        if (API_PATH.matcher(path).find() || API_QUERY.matcher(query).find()) return Optional.of(ContentType.API);
        return Optional.empty();
    }

    /** 페이로드 앞부분 스니핑 */
    public static ContentType sniff(byte[] bytes) {
        if (bytes == null || bytes.length == 0) return ContentType.UNKNOWN;

        int start = startsWith(bytes, UTF8_BOM, 0) ? UTF8_BOM.length : 0;
        int end = Math.min(bytes.length, start + SNIFF_BYTES);

        if (looksBinary(bytes, start, end)) return ContentType.UNKNOWN;

        String head = new String(bytes, start, end - start, StandardCharsets.UTF_8)
                .stripLeading()
                .toLowerCase(Locale.ROOT);
        if (head.isEmpty()) return ContentType.UNKNOWN;

        char c0 = head.charAt(0);
        if (c0 == '{' || c0 == '[') {
            return head.contains("jsonfeed.org/version") ? ContentType.FEED : ContentType.API;
        }
        if (head.startsWith("<rss") || head.startsWith("<feed") || head.startsWith("<rdf:rdf")) {
            return ContentType.FEED;
        }
        if (head.startsWith("<?xml")) {
            if (head.contains("<rss") || head.contains("<feed") || head.contains("<rdf:rdf")) return ContentType.FEED;
            if (head.contains("<html") || head.contains("<!doctype html")) return ContentType.HTML;
            return ContentType.API;
        }
        return ContentType.HTML;
    }

    private static boolean looksBinary(byte[] b, int start, int end) {
        if (startsWith(b, "%PDF".getBytes(StandardCharsets.US_ASCII), start)) return true;
        if (startsWith(b, new byte[]{(byte) 0x89, 'P', 'N', 'G'}, start)) return true;
        if (startsWith(b, "GIF8".getBytes(StandardCharsets.US_ASCII), start)) return true;
        if (startsWith(b, new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}, start)) return true;
        if (startsWith(b, new byte[]{'P', 'K', 3, 4}, start)) return true;
        for (int i = start; i < end; i++) {
            if (b[i] == 0) return true;
        }
        return false;
    }

    private static boolean startsWith(byte[] b, byte[] prefix, int offset) {
        if (b.length - offset < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (b[offset + i] != prefix[i]) return false;
        }
        return true;
    }
}
