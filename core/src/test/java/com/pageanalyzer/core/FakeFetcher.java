package com.pageanalyzer.core;

import com.pageanalyzer.core.api.IFetcher;
import com.pageanalyzer.core.exception.FetchException;
import com.pageanalyzer.core.model.FetchResponse;
import com.pageanalyzer.core.util.UrlUtils;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** 맵 기반 가짜 fetch. 스텁 없는 URL 은 404. */
public final class FakeFetcher implements IFetcher {

    static final class Stub {
        final int status; final String contentType; final String body; final long delayMs; final String err;
        Stub(int status, String contentType, String body, long delayMs, String err) {
            this.status = status; this.contentType = contentType; this.body = body; this.delayMs = delayMs; this.err = err;
        }
    }

    private final Map<String, Stub> byUri = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public FakeFetcher stub(String url, int status, String contentType, String body) {
        byUri.put(key(url), new Stub(status, contentType, body, 0L, null));
        return this;
    }

    public FakeFetcher html(String url, String body) {
        return stub(url, 200, "text/html; charset=utf-8", body);
    }

    public FakeFetcher xml(String url, String body) {
        return stub(url, 200, "application/rss+xml", body);
    }

    public FakeFetcher json(String url, String body) {
        return stub(url, 200, "application/json", body);
    }

    public FakeFetcher status(String url, int status) {
        return stub(url, status, "text/html", "");
    }

    /** 기존 스텁에 지연 추가 */
    public FakeFetcher delay(String url, long delayMs) {
        Stub s = byUri.get(key(url));
        if (s == null) throw new IllegalStateException("no stub for " + url);
        byUri.put(key(url), new Stub(s.status, s.contentType, s.body, delayMs, s.err));
        return this;
    }

    public FakeFetcher fail(String url, String err) {
        byUri.put(key(url), new Stub(0, null, "", 0L, err));
        return this;
    }

    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long callCount(String url) {
        String k = key(url);
        return calls().stream().filter(k::equals).count();
    }

    @Override
    public FetchResponse fetch(URI url, Duration timeout) {
        String k = UrlUtils.dedupeKey(url);
        calls.add(k);
        Stub s = byUri.get(k);
        if (s == null) {
            return FetchResponse.builder().url(url).statusCode(404).body("").build();
        }
        if (s.delayMs > 0) {
            try {
                Thread.sleep(s.delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw FetchException.transport(url.toString(), e);
            }
        }
        if (s.err != null) {
            throw FetchException.transport(url.toString(), new IOException(s.err));
        }
        FetchResponse.Builder b = FetchResponse.builder()
                .url(url)
                .statusCode(s.status)
                .body(s.body)
                .elapsedMs(Math.max(1L, s.delayMs));
        if (s.contentType != null) b.header("Content-Type", s.contentType);
        return b.build();
    }

    private static String key(String url) {
        return UrlUtils.dedupeKey(URI.create(url));
    }
}
