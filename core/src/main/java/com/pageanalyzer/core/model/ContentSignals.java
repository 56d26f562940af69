package com.pageanalyzer.core.model;

/**
 * 스코어링 입력으로 쓰이는 추출 부산물.
 * - boilerplateRatio: 본문 대비 버려진 텍스트 비율(0..1)
 * - languageConfidence: 언어 감지 신뢰도(0..1, 감지 안 했으면 0)
 * - structuredMetadata: og/JSON-LD/article:* 등 구조화 메타 존재 여부
 * - bodylessEntryRatio: 피드에서 본문 없는(제목만) 엔트리 비율
 */
public record ContentSignals(double boilerplateRatio,
                             double languageConfidence,
                             boolean structuredMetadata,
                             double bodylessEntryRatio) {

    public static final ContentSignals NONE = new ContentSignals(0.0, 0.0, false, 0.0);

    public ContentSignals {
        boilerplateRatio = clamp01(boilerplateRatio);
        languageConfidence = clamp01(languageConfidence);
        bodylessEntryRatio = clamp01(bodylessEntryRatio);
    }

    public ContentSignals withLanguageConfidence(double c) {
        return new ContentSignals(boilerplateRatio, c, structuredMetadata, bodylessEntryRatio);
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
