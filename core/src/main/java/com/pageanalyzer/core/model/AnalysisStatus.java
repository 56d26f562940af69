package com.pageanalyzer.core.model;

import java.util.Locale;

/** 단일 분석의 종료 상태. 모두 terminal. */
public enum AnalysisStatus {
    SUCCESS,
    ERROR,
    TIMEOUT,
    BLOCKED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 배치 집계에서 failed 로 세는 상태 */
    public boolean isFailure() {
        return this == ERROR || this == BLOCKED;
    }
}
