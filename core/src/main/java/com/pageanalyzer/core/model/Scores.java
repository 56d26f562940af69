package com.pageanalyzer.core.model;

/** relevance/quality/freshness 3종 점수. 생성 시 [0,1]로 클램프. */
public record Scores(double relevance, double quality, double freshness) {

    public static final Scores ZERO = new Scores(0.0, 0.0, 0.0);

    public Scores {
        relevance = clamp01(relevance);
        quality = clamp01(quality);
        freshness = clamp01(freshness);
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
