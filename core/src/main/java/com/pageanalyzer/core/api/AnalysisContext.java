package com.pageanalyzer.core.api;

import com.pageanalyzer.core.model.AnalysisConfig;
import com.pageanalyzer.core.model.AnalysisRecord;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * 요청 1건 범위의 분석 컨텍스트.
 * 분석기는 단계마다 {@link #checkpoint(AnalysisRecord.Builder)} 로 중간 결과를 남기고,
 * 마감 초과 시 관리자가 마지막 체크포인트를 timeout 레코드로 돌려준다.
 */
public final class AnalysisContext {
    private final String url;
    private final AnalysisConfig config;
    private final Clock clock;
    private volatile AnalysisRecord checkpoint;

    public AnalysisContext(String url, AnalysisConfig config, Clock clock) {
        this.url = Objects.requireNonNull(url, "url");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = (clock == null ? Clock.systemUTC() : clock);
    }

    public String url() { return url; }
    public AnalysisConfig config() { return config; }
    public Clock clock() { return clock; }
    public Instant now() { return clock.instant(); }

    /** 현재 빌더 상태를 스냅샷으로 고정 */
    public void checkpoint(AnalysisRecord.Builder b) {
        if (b == null) return;
        this.checkpoint = b.build();
    }

    /** 마지막 체크포인트, 없으면 null */
    public AnalysisRecord lastCheckpoint() {
        return checkpoint;
    }
}
