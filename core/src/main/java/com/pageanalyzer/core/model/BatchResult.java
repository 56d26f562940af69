package com.pageanalyzer.core.model;

import java.util.List;

/** 배치 결과: records 는 입력 순서와 1:1 정렬 */
public record BatchResult(List<AnalysisRecord> records, Aggregate aggregate) {

    public BatchResult {
        records = (records == null ? List.of() : List.copyOf(records));
        aggregate = (aggregate == null ? Aggregate.of(records, 0L) : aggregate);
    }

    public static BatchResult empty() {
        return new BatchResult(List.of(), new Aggregate(0, 0, 0, 0L));
    }

    /** 상태별 집계. failed = error + blocked */
    public record Aggregate(int succeeded, int failed, int timedOut, long totalElapsedMs) {

        public Aggregate {
            totalElapsedMs = Math.max(0L, totalElapsedMs);
        }

        public static Aggregate of(List<AnalysisRecord> records, long elapsedMs) {
            int ok = 0, fail = 0, to = 0;
            for (AnalysisRecord r : records) {
                switch (r.getStatus()) {
                    case SUCCESS -> ok++;
                    case TIMEOUT -> to++;
                    case ERROR, BLOCKED -> fail++;
                }
            }
            return new Aggregate(ok, fail, to, elapsedMs);
        }
    }
}
