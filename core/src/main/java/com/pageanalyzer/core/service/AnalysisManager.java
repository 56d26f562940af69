package com.pageanalyzer.core.service;

import com.pageanalyzer.core.api.AnalysisContext;
import com.pageanalyzer.core.api.IContentAnalyzer;
import com.pageanalyzer.core.api.IFetcher;
import com.pageanalyzer.core.exception.AnalysisException;
import com.pageanalyzer.core.exception.ContentParseException;
import com.pageanalyzer.core.exception.FetchException;
import com.pageanalyzer.core.feed.FeedAnalyzer;
import com.pageanalyzer.core.feed.FeedDiscoverer;
import com.pageanalyzer.core.html.HtmlAnalyzer;
import com.pageanalyzer.core.http.HttpFetcher;
import com.pageanalyzer.core.lang.LanguageDetector;
import com.pageanalyzer.core.model.AnalysisConfig;
import com.pageanalyzer.core.model.AnalysisRecord;
import com.pageanalyzer.core.model.AnalysisRequest;
import com.pageanalyzer.core.model.AnalysisStatus;
import com.pageanalyzer.core.model.ApiAnalysisRecord;
import com.pageanalyzer.core.model.BatchResult;
import com.pageanalyzer.core.model.ContentType;
import com.pageanalyzer.core.model.FeedDiscoveryResult;
import com.pageanalyzer.core.model.FetchResponse;
import com.pageanalyzer.core.model.PageMetadata;
import com.pageanalyzer.core.model.Scores;
import com.pageanalyzer.core.model.Timing;
import com.pageanalyzer.core.payload.ApiAnalyzer;
import com.pageanalyzer.core.resolve.ContentTypeResolver;
import com.pageanalyzer.core.scoring.ScoringEngine;
import com.pageanalyzer.core.scoring.ScoringParams;
import com.pageanalyzer.core.util.StructuredLog;
import com.pageanalyzer.core.util.UrlUtils;
import com.pageanalyzer.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 분석 오케스트레이터:
 *  - fetch → 유형 판별 → 분석기 디스패치 → 스코어링 → AnalysisRecord
 *  - 요청마다 마감(timeoutMs) 적용, 초과 시 마지막 체크포인트를 timeout 으로 반환
 *  - 배치는 고정 폭 워커 풀, 결과는 입력 순서
 *  - 어떤 실패도 예외로 새지 않고 종료 상태 + 메시지가 담긴 레코드 1건이 된다
 */
public final class AnalysisManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisManager.class);
    private static final StructuredLog SLOG = StructuredLog.get(AnalysisManager.class);

    /** 접근 차단으로 보는 HTTP 상태 */
    static final Set<Integer> BLOCKED_STATUS = Set.of(401, 403, 407, 429, 451);

    private final IFetcher fetcher;
    private final AnalysisConfig config;
    private final Clock clock;

    private final HtmlAnalyzer htmlAnalyzer;
    private final FeedAnalyzer feedAnalyzer;
    private final ApiAnalyzer apiAnalyzer;
    private final Map<ContentType, IContentAnalyzer> analyzers = new EnumMap<>(ContentType.class);

    /** 요청별 분석 작업 실행기 (마감 초과 작업은 interrupt 후 버린다) */
    private final ExecutorService taskExec;

    /** 기본 구현: analyzer.yml(없으면 기본값) + JDK HttpClient */
    public static AnalysisManager create() throws IOException {
        Path yml = Path.of(YamlConfigLoader.DEFAULT_FILE);
        AnalysisConfig cfg;
        if (Files.exists(yml)) {
            cfg = YamlConfigLoader.load(yml);
        } else {
            LOG.info("{} not found, using built-in defaults", YamlConfigLoader.DEFAULT_FILE);
            cfg = AnalysisConfig.defaults();
        }
        return new AnalysisManager(new HttpFetcher(cfg), cfg, Clock.systemUTC());
    }

    public AnalysisManager(IFetcher fetcher) {
        this(fetcher, AnalysisConfig.defaults(), Clock.systemUTC());
    }

    public AnalysisManager(IFetcher fetcher, AnalysisConfig config) {
        this(fetcher, config, Clock.systemUTC());
    }

    /** DI/테스트용 */
    public AnalysisManager(IFetcher fetcher, AnalysisConfig config, Clock clock) {
        this(fetcher, config, clock, List.of());
    }

    /** 테스트 훅: 유형별 분석기 교체 (같은 contentType 의 기본 분석기를 덮어쓴다) */
    AnalysisManager(IFetcher fetcher, AnalysisConfig config, Clock clock, List<IContentAnalyzer> overrides) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.config = Objects.requireNonNull(config, "config").copy();
        this.config.validate();
        this.clock = (clock == null ? Clock.systemUTC() : clock);

        LanguageDetector lang = LanguageDetector.defaultDetector();
        this.htmlAnalyzer = new HtmlAnalyzer(lang);
        this.feedAnalyzer = new FeedAnalyzer(lang);
        this.apiAnalyzer = new ApiAnalyzer(lang);
        register(htmlAnalyzer);
        register(feedAnalyzer);
        register(apiAnalyzer);
        for (IContentAnalyzer a : overrides) register(a);

        this.taskExec = Executors.newCachedThreadPool(new WorkerPool.NamedThreadFactory("analysis-task"));
    }

    private void register(IContentAnalyzer a) {
        analyzers.put(a.contentType(), a);
    }

    /** 기본 설정 복사본 */
    public AnalysisConfig getConfig() {
        return config.copy();
    }

    /* =========================
       단건 분석
       ========================= */

    public AnalysisRecord analyzeOne(String url) {
        return analyzeOne(AnalysisRequest.of(url));
    }

    public AnalysisRecord analyzeOne(String url, String contentTypeHint, Map<String, Object> options) {
        return analyzeOne(new AnalysisRequest(url, contentTypeHint, options));
    }

    /** 항상 레코드 1건을 돌려준다 (예외 없음) */
    public AnalysisRecord analyzeOne(AnalysisRequest request) {
        Objects.requireNonNull(request, "request");
        AnalysisConfig cfg;
        try {
            cfg = config.withOptions(request.options());
        } catch (RuntimeException e) {
            return failure(String.valueOf(request.url()), AnalysisStatus.ERROR, "invalid options: " + e.getMessage(), null, 0L);
        }
        return analyze(request.url(), request.contentTypeHint(), cfg);
    }

    private AnalysisRecord analyze(String rawUrl, String hint, AnalysisConfig cfg) {
        final long t0 = System.nanoTime();
        final String url = (rawUrl == null ? "" : rawUrl.trim());

        URI uri = UrlUtils.parseHttp(url);
        if (uri == null) {
            String msg = url.isEmpty() ? "empty URL" : "invalid URL: " + url;
            LOG.warn("Rejected request: {}", msg);
            return failure(url, AnalysisStatus.ERROR, msg, null, elapsedMs(t0));
        }

        LOG.debug("Analyze start: {} (hint={})", url, hint);
        SLOG.debug("analysis-start", "url", url, "hint", hint, "timeoutMs", cfg.getTimeoutMs());

        AnalysisContext ctx = new AnalysisContext(url, cfg, clock);
        Future<AnalysisRecord> future;
        try {
            future = taskExec.submit(() -> runPipeline(uri, hint, ctx, t0));
        } catch (RejectedExecutionException e) {
            return failure(url, AnalysisStatus.ERROR, "analysis rejected: manager closed", null, elapsedMs(t0));
        }

        AnalysisRecord result;
        try {
            result = future.get(cfg.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            result = timedOut(ctx, AnalysisException.timeout(url, cfg.getTimeoutMs()).getMessage(), elapsedMs(t0));
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            result = fromFailure(ctx, cause, elapsedMs(t0));
        } catch (CancellationException e) {
            result = failure(url, AnalysisStatus.ERROR, "analysis cancelled", ctx.lastCheckpoint(), elapsedMs(t0));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            result = timedOut(ctx, "analysis interrupted", elapsedMs(t0));
        }

        logDone(result);
        return result;
    }

    /** 작업 스레드에서 실행되는 단건 파이프라인 */
    private AnalysisRecord runPipeline(URI uri, String hint, AnalysisContext ctx, long t0) {
        final String url = ctx.url();
        final AnalysisConfig cfg = ctx.config();

        // ---- 1) fetch ----
        FetchResponse resp = fetcher.fetch(uri, cfg.getTimeout());
        final long contentLength = resp.getContentLength();
        if (resp.getContentLength() > cfg.getMaxContentBytes()) {
            LOG.debug("Truncating {} from {} to {} bytes", url, contentLength, cfg.getMaxContentBytes());
            resp = resp.truncate(cfg.getMaxContentBytes());
        }

        // ---- 2) 유형 판별 ----
        ContentType type = ContentTypeResolver.resolve(url, hint, resp.head(ContentTypeResolver.SNIFF_BYTES));
        ctx.checkpoint(AnalysisRecord.builder()
                .url(url)
                .resolvedContentType(type)
                .statusCode(resp.getStatusCode())
                .contentLength(contentLength)
                .analyzedAt(clock.instant()));

        if (BLOCKED_STATUS.contains(resp.getStatusCode())) {
            return failure(url, AnalysisStatus.BLOCKED, "HTTP " + resp.getStatusCode() + " (access blocked)",
                    ctx.lastCheckpoint(), elapsedMs(t0), resp.getElapsedMs());
        }
        if (resp.isHttpError()) {
            return failure(url, AnalysisStatus.ERROR, "HTTP " + resp.getStatusCode(),
                    ctx.lastCheckpoint(), elapsedMs(t0), resp.getElapsedMs());
        }

        // ---- 3) 디스패치 ----
        IContentAnalyzer analyzer = analyzers.get(type);
        AnalysisRecord.Builder b;
        if (analyzer == null) {
            // 판별 불가(바이너리 등): 내용 없이 성공
            b = AnalysisRecord.builder().url(url).resolvedContentType(ContentType.UNKNOWN);
        } else {
            b = analyzer.analyze(resp, ctx);
            if (Thread.currentThread().isInterrupted()) {
                throw AnalysisException.timeout(url, cfg.getTimeoutMs());
            }
            if (!b.build().hasContent()) {
                throw ContentParseException.noContent(url);
            }
        }

        // ---- 4) 조립 + 스코어링 (UNKNOWN 은 점수 0) ----
        AnalysisRecord record = b
                .status(AnalysisStatus.SUCCESS)
                .statusCode(resp.getStatusCode())
                .contentLength(contentLength)
                .timing(new Timing(resp.getElapsedMs(), elapsedMs(t0)))
                .analyzedAt(clock.instant())
                .build();
        if (analyzer == null) return record;
        return record.toBuilder()
                .scores(ScoringEngine.score(record, ScoringParams.from(cfg), clock.instant()))
                .build();
    }

    /* =========================
       배치
       ========================= */

    public BatchResult analyzeBatch(List<String> urls) {
        return analyzeBatch(urls, config.getMaxConcurrent(), null);
    }

    /**
     * 고정 폭 풀에서 URL 별로 독립 분석. 결과는 입력 순서, 길이 == 입력 길이 (중복 포함).
     * maxConcurrent < 1 이면 기본 설정값.
     */
    public BatchResult analyzeBatch(List<String> urls, int maxConcurrent, Map<String, Object> options) {
        if (urls == null || urls.isEmpty()) return BatchResult.empty();
        final long t0 = System.nanoTime();

        AnalysisConfig cfg;
        try {
            cfg = config.withOptions(options);
        } catch (RuntimeException e) {
            List<AnalysisRecord> failed = new ArrayList<>(urls.size());
            for (String u : urls) failed.add(failure(String.valueOf(u), AnalysisStatus.ERROR, "invalid options: " + e.getMessage(), null, 0L));
            return new BatchResult(failed, BatchResult.Aggregate.of(failed, elapsedMs(t0)));
        }

        final int cc = (maxConcurrent >= 1 ? maxConcurrent : cfg.getMaxConcurrent());
        LOG.info("Batch start: urls={}, cc={}, timeoutMs={}", urls.size(), cc, cfg.getTimeoutMs());
        SLOG.info("batch-start", "urls", urls.size(), "cc", cc, "timeoutMs", cfg.getTimeoutMs());

        List<AnalysisRecord> records;
        int maxObserved;
        try (WorkerPool pool = new WorkerPool("analysis-worker", cc)) {
            records = pool.mapOrdered(urls,
                    u -> analyze(u, null, cfg),
                    (u, err) -> {
                        SLOG.warn("task-failed", "url", String.valueOf(u), "error", err.toString());
                        return failure(String.valueOf(u), AnalysisStatus.ERROR, String.valueOf(err.getMessage()), null, 0L);
                    });
            maxObserved = pool.maxObservedConcurrency();
        }

        long ms = elapsedMs(t0);
        BatchResult.Aggregate agg = BatchResult.Aggregate.of(records, ms);
        LOG.info("Batch done: succeeded={}, failed={}, timedOut={}, maxObservedCC={}, {}ms",
                agg.succeeded(), agg.failed(), agg.timedOut(), maxObserved, ms);
        SLOG.info("batch-done",
                "urls", urls.size(),
                "succeeded", agg.succeeded(),
                "failed", agg.failed(),
                "timedOut", agg.timedOut(),
                "maxObservedCC", maxObserved,
                "elapsedMs", ms);
        return new BatchResult(records, agg);
    }

    /* =========================
       피드 탐색 / API 페이로드 / 메타데이터
       ========================= */

    public FeedDiscoveryResult discoverFeeds(String url) {
        return discoverFeeds(url, config.getFeedDiscoveryDepth(), config.isValidateFeeds());
    }

    public FeedDiscoveryResult discoverFeeds(String url, int depth, boolean validate) {
        try {
            return new FeedDiscoverer(fetcher, feedAnalyzer, clock).discover(url, depth, validate, config);
        } catch (RuntimeException e) {
            LOG.warn("Feed discovery failed: {} ({})", url, e.toString());
            SLOG.warn("task-failed", "url", String.valueOf(url), "op", "discoverFeeds", "error", e.toString());
            return FeedDiscoveryResult.failed(String.valueOf(url), e.getMessage(), 0L);
        }
    }

    /**
     * rawPayload 가 null 이면 endpointUrl 을 직접 가져와 분석한다.
     * fetch 실패(HTTP 오류, 전송 오류)는 errorMessage 레코드로 돌려준다.
     */
    public ApiAnalysisRecord analyzeApiPayload(String endpointUrl, String rawPayload, String schemaHint) {
        if (rawPayload != null) {
            return apiAnalyzer.analyzePayload(endpointUrl, rawPayload, schemaHint);
        }

        final long t0 = System.nanoTime();
        String u = (endpointUrl == null ? "" : endpointUrl.trim());
        URI uri = UrlUtils.parseHttp(u);
        if (uri == null) {
            return ApiAnalysisRecord.error(u, "Failed to fetch API data: invalid URL: " + u, elapsedMs(t0));
        }
        try {
            FetchResponse resp = fetcher.fetch(uri, config.getTimeout());
            if (resp.isHttpError()) {
                LOG.warn("API fetch failed: {} (HTTP {})", u, resp.getStatusCode());
                return ApiAnalysisRecord.error(u, "Failed to fetch API data: HTTP " + resp.getStatusCode(), elapsedMs(t0));
            }
            return apiAnalyzer.analyzePayload(u, resp.truncate(config.getMaxContentBytes()).bodyAsString(), schemaHint);
        } catch (FetchException e) {
            LOG.warn("API fetch failed: {} ({})", u, e.getMessage());
            SLOG.warn("task-failed", "url", u, "op", "analyzeApiPayload", "error", e.getMessage());
            return ApiAnalysisRecord.error(u, "Failed to fetch API data: " + e.getMessage(), elapsedMs(t0));
        }
    }

    /**
     * quickMode: fetch + 메타데이터만 (본문/링크/점수 없음, HTML 이외는 해당 분석기 결과에서 투영).
     * 아니면 analyzeOne 결과를 투영.
     */
    public PageMetadata getPageMetadata(String url, boolean quickMode) {
        if (!quickMode) return PageMetadata.from(analyzeOne(url));

        final long t0 = System.nanoTime();
        String u = (url == null ? "" : url.trim());
        URI uri = UrlUtils.parseHttp(u);
        if (uri == null) return PageMetadata.error(u, u.isEmpty() ? "empty URL" : "invalid URL: " + u);

        try {
            FetchResponse resp = fetcher.fetch(uri, config.getTimeout());
            long contentLength = resp.getContentLength();
            if (resp.isHttpError()) {
                return PageMetadata.from(failure(u,
                        BLOCKED_STATUS.contains(resp.getStatusCode()) ? AnalysisStatus.BLOCKED : AnalysisStatus.ERROR,
                        "HTTP " + resp.getStatusCode(),
                        AnalysisRecord.builder().url(u).statusCode(resp.getStatusCode()).contentLength(contentLength).build(),
                        elapsedMs(t0), resp.getElapsedMs()));
            }
            resp = resp.truncate(config.getMaxContentBytes());

            AnalysisContext ctx = new AnalysisContext(u, config, clock);
            ContentType type = ContentTypeResolver.resolve(u, null, resp.head(ContentTypeResolver.SNIFF_BYTES));
            AnalysisRecord.Builder b = switch (type) {
                case HTML -> htmlAnalyzer.metadataOnly(resp, ctx);
                case FEED, API -> analyzers.get(type).analyze(resp, ctx);
                case UNKNOWN -> AnalysisRecord.builder().url(u).resolvedContentType(ContentType.UNKNOWN);
            };
            return PageMetadata.from(b
                    .statusCode(resp.getStatusCode())
                    .contentLength(contentLength)
                    .timing(new Timing(resp.getElapsedMs(), elapsedMs(t0)))
                    .analyzedAt(clock.instant())
                    .build());
        } catch (AnalysisException e) {
            LOG.warn("Metadata extraction failed: {} ({})", u, e.getMessage());
            return PageMetadata.error(u, e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Metadata extraction failed: {} ({})", u, e.toString());
            SLOG.warn("task-failed", "url", u, "op", "getPageMetadata", "error", e.toString());
            return PageMetadata.error(u, e.toString());
        }
    }

    @Override
    public void close() {
        taskExec.shutdownNow();
    }

    /* =========================
       종료 레코드 조립
       ========================= */

    private AnalysisRecord timedOut(AnalysisContext ctx, String message, long elapsedMs) {
        AnalysisRecord cp = ctx.lastCheckpoint();
        AnalysisRecord.Builder b = (cp != null) ? cp.toBuilder() : AnalysisRecord.builder().url(ctx.url());
        return b.status(AnalysisStatus.TIMEOUT)
                .errorMessage(message)
                .scores(Scores.ZERO)
                .timing(new Timing(cp != null ? cp.getTiming().responseTimeMs() : 0L, elapsedMs))
                .analyzedAt(clock.instant())
                .build();
    }

    private AnalysisRecord fromFailure(AnalysisContext ctx, Throwable cause, long elapsedMs) {
        if (cause instanceof FetchException fe && fe.isTimeout()) {
            return timedOut(ctx, fe.getMessage(), elapsedMs);
        }
        if (cause instanceof AnalysisException ae) {
            if (ae.getKind() == AnalysisException.ErrorKind.TIMEOUT) {
                return timedOut(ctx, ae.getMessage(), elapsedMs);
            }
            return failure(ctx.url(), AnalysisStatus.ERROR, ae.getMessage(), ctx.lastCheckpoint(), elapsedMs);
        }
        LOG.warn("Unexpected analysis failure: {} ({})", ctx.url(), cause.toString());
        SLOG.error("task-failed", cause, "url", ctx.url());
        return failure(ctx.url(), AnalysisStatus.ERROR, "internal error: " + cause, ctx.lastCheckpoint(), elapsedMs);
    }

    private AnalysisRecord failure(String url, AnalysisStatus status, String message, AnalysisRecord base, long elapsedMs) {
        return failure(url, status, message, base, elapsedMs, 0L);
    }

    /** 실패 레코드: 판별된 유형/상태코드/길이만 남기고 추출 필드는 비운다 */
    private AnalysisRecord failure(String url, AnalysisStatus status, String message, AnalysisRecord base,
                                   long elapsedMs, long responseMs) {
        AnalysisRecord.Builder b = AnalysisRecord.builder()
                .url(url)
                .status(status)
                .errorMessage(message)
                .timing(new Timing(responseMs, elapsedMs))
                .analyzedAt(clock.instant());
        if (base != null) {
            b.resolvedContentType(base.getResolvedContentType())
             .statusCode(base.getStatusCode())
             .contentLength(base.getContentLength());
        } else {
            b.resolvedContentType(ContentType.UNKNOWN);
        }
        return b.build();
    }

    private static void logDone(AnalysisRecord r) {
        if (r.getStatus() == AnalysisStatus.SUCCESS) {
            LOG.debug("Analyzed {} -> {} ({}ms)", r.getUrl(), r.getResolvedContentType().wireName(),
                    r.getTiming().processingTimeMs());
            SLOG.debug("analysis-done",
                    "url", r.getUrl(),
                    "type", r.getResolvedContentType().wireName(),
                    "status", r.getStatus().wireName(),
                    "elapsedMs", r.getTiming().processingTimeMs());
        } else {
            LOG.warn("Analysis {} for {}: {}", r.getStatus().wireName(), r.getUrl(), r.getErrorMessage());
            SLOG.warn("analysis-done",
                    "url", r.getUrl(),
                    "type", r.getResolvedContentType().wireName(),
                    "status", r.getStatus().wireName(),
                    "error", r.getErrorMessage(),
                    "elapsedMs", r.getTiming().processingTimeMs());
        }
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
