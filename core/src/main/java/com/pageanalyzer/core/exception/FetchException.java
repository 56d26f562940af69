package com.pageanalyzer.core.exception;

/**
 * fetch 협력자 실패 (전송 계층). 관리자 내부 재시도 없음.
 */
public class FetchException extends AnalysisException {

    private final boolean timeout;

    public FetchException(String message, String url, boolean timeout, Throwable cause) {
        super(timeout ? ErrorKind.TIMEOUT : ErrorKind.TRANSPORT, message, url, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }

    public static FetchException transport(String url, Throwable cause) {
        String why = (cause == null) ? "unknown" : cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        return new FetchException("fetch failed: " + why, url, false, cause);
    }

    public static FetchException timedOut(String url, long timeoutMs) {
        return new FetchException("fetch timed out after " + timeoutMs + "ms", url, true, null);
    }

    public static FetchException invalidUrl(String url) {
        return new FetchException("invalid URL: " + url, url, false, null);
    }
}
