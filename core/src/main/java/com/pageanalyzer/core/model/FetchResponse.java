package com.pageanalyzer.core.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** fetch 결과 캡처. 본문은 원시 바이트로 보관 (인코딩은 분석기에서 결정) */
public final class FetchResponse {
    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final long elapsedMs;
    private final boolean truncated;

    private FetchResponse(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? new byte[0] : b.body;
        this.elapsedMs = Math.max(0L, b.elapsedMs);
        this.truncated = b.truncated;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public long getElapsedMs() { return elapsedMs; }
    public boolean isTruncated() { return truncated; }
    public int getContentLength() { return body.length; }

    /** 방어적 복사본 */
    public byte[] getBody() { return body.clone(); }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    /** Content-Type 헤더의 MIME 부분(소문자). 없으면 null */
    public String mimeType() {
        String ct = header("Content-Type");
        if (ct == null) return null;
        int semi = ct.indexOf(';');
        return (semi >= 0 ? ct.substring(0, semi) : ct).trim().toLowerCase(Locale.ROOT);
    }

    /** Content-Type charset 파라미터, 없거나 모르면 UTF-8 */
    public Charset charset() {
        String ct = header("Content-Type");
        if (ct != null) {
            for (String part : ct.split(";")) {
                String p = part.trim();
                if (p.regionMatches(true, 0, "charset=", 0, 8)) {
                    String name = p.substring(8).replace("\"", "").trim();
                    try {
                        return Charset.forName(name);
                    } catch (IllegalArgumentException ignore) {
                        // 알 수 없는 charset → UTF-8
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    public String bodyAsString() {
        return new String(body, charset());
    }

    /** 앞부분 n 바이트 (타입 스니핑용) */
    public byte[] head(int n) {
        return Arrays.copyOf(body, Math.min(Math.max(0, n), body.length));
    }

    public boolean isHttpError() { return statusCode >= 400; }

    /** maxBytes 초과 본문을 잘라낸 사본. 이미 작으면 this */
    public FetchResponse truncate(int maxBytes) {
        if (maxBytes <= 0 || body.length <= maxBytes) return this;
        return toBuilder().body(Arrays.copyOf(body, maxBytes)).truncated(true).build();
    }

    public Builder toBuilder() {
        return new Builder().url(url).statusCode(statusCode).headers(headers)
                .body(body).elapsedMs(elapsedMs).truncated(truncated);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode = 200;
        private Map<String, List<String>> headers;
        private byte[] body;
        private long elapsedMs;
        private boolean truncated;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) {
            this.headers = (headers == null ? null : new LinkedHashMap<>(headers));
            return this;
        }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder body(String body) {
            this.body = (body == null ? null : body.getBytes(StandardCharsets.UTF_8));
            return this;
        }
        public Builder header(String name, String value) {
            if (this.headers == null) this.headers = new LinkedHashMap<>();
            this.headers.put(name, List.of(value));
            return this;
        }
        public Builder elapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; return this; }
        public Builder truncated(boolean truncated) { this.truncated = truncated; return this; }

        public FetchResponse build() {
            Objects.requireNonNull(url, "url");
            return new FetchResponse(this);
        }
    }
}
