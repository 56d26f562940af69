package com.pageanalyzer.core.api;

import com.pageanalyzer.core.model.AnalysisRecord;
import com.pageanalyzer.core.model.ContentType;
import com.pageanalyzer.core.model.FetchResponse;

/**
 * 콘텐츠 타입별 분석 전략.
 * 반환 빌더는 url/타입/추출 필드만 채운다. 상태, 점수, 타이밍은 관리자가 조립한다.
 * 파싱 실패 시 {@link com.pageanalyzer.core.exception.AnalysisException} 계열을 던진다.
 */
public interface IContentAnalyzer {

    ContentType contentType();

    AnalysisRecord.Builder analyze(FetchResponse response, AnalysisContext ctx);
}
