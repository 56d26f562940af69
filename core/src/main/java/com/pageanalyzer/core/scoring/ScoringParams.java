package com.pageanalyzer.core.scoring;

import com.pageanalyzer.core.model.AnalysisConfig;

/**
 * 스코어링 파라미터. 설정에서 명시적으로 만들어 넘긴다.
 * enabled=false 면 모든 점수가 0.
 */
public record ScoringParams(int halfLifeDays, int horizonDays, boolean enabled) {

    public static final ScoringParams DEFAULTS = new ScoringParams(30, 365, true);

    public ScoringParams {
        if (halfLifeDays <= 0) throw new IllegalArgumentException("halfLifeDays must be > 0");
        if (horizonDays <= 0) throw new IllegalArgumentException("horizonDays must be > 0");
    }

    public static ScoringParams from(AnalysisConfig cfg) {
        return new ScoringParams(cfg.getFreshnessHalfLifeDays(), cfg.getFreshnessHorizonDays(), cfg.isCalculateScores());
    }
}
