package com.pageanalyzer.core.exception;

/**
 * 분석 관련 예외 기본 클래스.
 * AnalysisManager 경계에서 잡혀 종료 상태(error/timeout) + 메시지로 변환된다.
 */
public class AnalysisException extends RuntimeException {

    public enum ErrorKind { RESOLUTION, PARSE, TIMEOUT, TRANSPORT, VALIDATION }

    private final ErrorKind kind;
    private final String url;

    public AnalysisException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public AnalysisException(ErrorKind kind, String message, String url) {
        this(kind, message, url, null);
    }

    public AnalysisException(ErrorKind kind, String message, String url, Throwable cause) {
        super(message, cause);
        this.kind = (kind == null ? ErrorKind.PARSE : kind);
        this.url = url;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getUrl() {
        return url;
    }

    /**
     * 입력이 비었거나 URL 이 잘못됨
     */
    public static AnalysisException resolution(String url, String reason) {
        return new AnalysisException(ErrorKind.RESOLUTION, reason, url);
    }

    /**
     * 분석 마감 초과
     */
    public static AnalysisException timeout(String url, long timeoutMs) {
        return new AnalysisException(ErrorKind.TIMEOUT, "analysis timed out after " + timeoutMs + "ms", url);
    }
}
