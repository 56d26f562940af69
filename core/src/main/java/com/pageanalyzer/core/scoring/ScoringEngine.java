package com.pageanalyzer.core.scoring;

import com.pageanalyzer.core.model.AnalysisRecord;
import com.pageanalyzer.core.model.ContentSignals;
import com.pageanalyzer.core.model.Scores;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * relevance / quality / freshness 계산 (순수 함수, 상태 없음).
 * relevance 는 질의와 무관한 "내용 풍부도" 근사치다.
 */
public final class ScoringEngine {
    private ScoringEngine() {}

    static final int RICH_CONTENT_CHARS = 500;
    static final int SOME_CONTENT_CHARS = 200;
    /** 이 길이에서 길이 점수가 포화 */
    static final int SATURATION_CHARS = 5000;
    static final double UNDATED_FRESHNESS = 0.5;

    public static Scores score(AnalysisRecord r, ScoringParams params, Instant now) {
        Objects.requireNonNull(params, "params");
        if (!params.enabled()) return Scores.ZERO;
        return new Scores(relevance(r), quality(r), freshness(r, now, params));
    }

    /** 제목 0.2, 설명 0.2, 본문 500자↑ 0.4 (200자↑ 0.2), 구조화 메타 0.2 */
    public static double relevance(AnalysisRecord r) {
        double s = 0.0;
        if (present(r.getTitle())) s += 0.2;
        if (present(r.getDescription())) s += 0.2;
        int len = length(r.getMainContent());
        if (len >= RICH_CONTENT_CHARS) s += 0.4;
        else if (len >= SOME_CONTENT_CHARS) s += 0.2;
        if (r.getSignals().structuredMetadata()) s += 0.2;
        return clamp01(s);
    }

    /**
     * 길이(log 스케일) 0.4 + 설명 0.1 + 저자 0.1 + 날짜 0.1
     * + 낮은 보일러플레이트 0.2 + 언어 신뢰도 0.1, 본문 없는 엔트리 비율만큼 최대 절반 감점.
     */
    public static double quality(AnalysisRecord r) {
        ContentSignals sig = r.getSignals();
        int len = length(r.getMainContent());

        double s = 0.4 * Math.min(1.0, Math.log1p(len) / Math.log1p(SATURATION_CHARS));
        if (present(r.getDescription())) s += 0.1;
        if (present(r.getAuthor())) s += 0.1;
        if (r.getPublishedAt() != null || r.getLastModifiedAt() != null) s += 0.1;
        if (len > 0) s += 0.2 * (1.0 - sig.boilerplateRatio());
        s += 0.1 * sig.languageConfidence();

        s *= 1.0 - 0.5 * sig.bodylessEntryRatio();
        return clamp01(s);
    }

    /**
     * 게시일(없으면 수정일) 기준 반감기 감쇠.
     * 날짜 없음 0.5, 미래 1.0, horizon 이상 0.
     */
    public static double freshness(AnalysisRecord r, Instant now, ScoringParams params) {
        Instant when = r.getPublishedAt() != null ? r.getPublishedAt() : r.getLastModifiedAt();
        return freshness(when, now, params);
    }

    public static double freshness(Instant when, Instant now, ScoringParams params) {
        if (when == null || now == null) return UNDATED_FRESHNESS;
        if (!when.isBefore(now)) return 1.0;

        double ageDays = Duration.between(when, now).toMillis() / 86_400_000.0;
        if (ageDays >= params.horizonDays()) return 0.0;
        return clamp01(Math.exp(-Math.log(2) * ageDays / params.halfLifeDays()));
    }

    private static boolean present(String s) {
        return s != null && !s.isBlank();
    }

    private static int length(String s) {
        return s == null ? 0 : s.strip().length();
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
