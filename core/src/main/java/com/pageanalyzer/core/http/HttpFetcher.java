package com.pageanalyzer.core.http;

import com.pageanalyzer.core.api.IFetcher;
import com.pageanalyzer.core.exception.FetchException;
import com.pageanalyzer.core.model.AnalysisConfig;
import com.pageanalyzer.core.model.FetchResponse;
import com.pageanalyzer.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * JDK HttpClient 기반 기본 fetch 어댑터.
 * GET 1회, 재시도 없음, robots.txt 처리 없음. 4xx/5xx 는 응답으로 그대로 돌려준다.
 */
public class HttpFetcher implements IFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final String userAgent;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public HttpFetcher(AnalysisConfig config) {
        Objects.requireNonNull(config, "config");
        this.userAgent = config.getUserAgent();
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpFetcher(AnalysisConfig config, HttpSender testSender) {
        Objects.requireNonNull(config, "config");
        this.userAgent = config.getUserAgent();
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResponse fetch(URI url, Duration timeout) throws FetchException {
        Objects.requireNonNull(url, "url");
        if (!UrlUtils.isHttp(url)) throw FetchException.invalidUrl(url.toString());

        long start = System.nanoTime();
        HttpRequest req = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,application/json;q=0.9,*/*;q=0.8")
                .GET()
                .build();
        try {
            HttpResponse<byte[]> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofByteArray());
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.debug("GET {} -> {} ({}ms)", url, resp.statusCode(), elapsedMs);

            return FetchResponse.builder()
                    .url(resp.uri() != null ? resp.uri() : url)
                    .statusCode(resp.statusCode())
                    .headers(resp.headers().map())
                    .body(resp.body() == null ? new byte[0] : resp.body())
                    .elapsedMs(elapsedMs)
                    .build();
        } catch (HttpTimeoutException e) {
            throw FetchException.timedOut(url.toString(), timeout.toMillis());
        } catch (IOException e) {
            throw FetchException.transport(url.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw FetchException.transport(url.toString(), e);
        }
    }
}
