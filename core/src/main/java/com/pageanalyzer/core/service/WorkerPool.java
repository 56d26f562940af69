package com.pageanalyzer.core.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 고정 폭 워커 풀 (+역압).
 *  - 폭 = width, 큐 = width*2, 큐가 차면 제출 스레드가 대기
 *  - {@link #mapOrdered} 결과는 입력 인덱스 순서 (완료 순서 아님)
 *  - 작업 하나의 실패는 onFailure 로 변환되어 다른 작업에 영향 없음
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerPool.class);

    private final ExecutorService exec;
    private final int width;
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger maxObserved = new AtomicInteger(0);

    public WorkerPool(String name, int width) {
        this.width = Math.max(1, width);
        this.exec = new ThreadPoolExecutor(
                this.width, this.width,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(this.width * 2),
                new NamedThreadFactory(name),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );
    }

    public int width() {
        return width;
    }

    /** 관측된 최대 동시 실행 수 */
    public int maxObservedConcurrency() {
        return maxObserved.get();
    }

    /**
     * 입력마다 task 를 풀에서 실행하고 결과를 입력 순서대로 돌려준다.
     * 출력 길이 == 입력 길이 (실패/중단 시 onFailure 결과로 채움).
     */
    public <T, R> List<R> mapOrdered(List<T> inputs, Function<T, R> task, BiFunction<T, Throwable, R> onFailure) {
        final List<Future<R>> futures = new ArrayList<>(inputs.size());
        final List<R> out = new ArrayList<>(inputs.size());

        // ---- 1) 제출 ----
        for (T in : inputs) {
            try {
                futures.add(exec.submit(() -> {
                    int cur = inFlight.incrementAndGet();
                    maxObserved.accumulateAndGet(cur, Math::max);
                    try {
                        return task.apply(in);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                }));
            } catch (RejectedExecutionException rex) {
                futures.add(null);
            }
        }

        // ---- 2) 인덱스 순서로 수집 ----
        boolean interrupted = false;
        for (int i = 0; i < inputs.size(); i++) {
            T in = inputs.get(i);
            Future<R> f = futures.get(i);
            if (f == null) {
                out.add(onFailure.apply(in, new RejectedExecutionException("pool rejected task")));
                continue;
            }
            if (interrupted) {
                f.cancel(true);
                out.add(onFailure.apply(in, new CancellationException("interrupted")));
                continue;
            }
            try {
                out.add(f.get());
            } catch (ExecutionException e) {
                Throwable cause = (e.getCause() != null ? e.getCause() : e);
                LOG.warn("Pool task failed: {}", cause.toString());
                out.add(onFailure.apply(in, cause));
            } catch (CancellationException ce) {
                out.add(onFailure.apply(in, ce));
            } catch (InterruptedException ie) {
                interrupted = true;
                f.cancel(true);
                out.add(onFailure.apply(in, ie));
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
        return out;
    }

    @Override
    public void close() {
        exec.shutdownNow();
        try {
            exec.awaitTermination(30, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
