package com.pageanalyzer.core.model;

/** 응답(fetch) 시간과 전체 처리 시간. 음수는 0으로 맞춘다. */
public record Timing(long responseTimeMs, long processingTimeMs) {

    public static final Timing NONE = new Timing(0L, 0L);

    public Timing {
        responseTimeMs = Math.max(0L, responseTimeMs);
        processingTimeMs = Math.max(0L, processingTimeMs);
    }
}
