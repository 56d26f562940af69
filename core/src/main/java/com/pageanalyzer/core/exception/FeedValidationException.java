package com.pageanalyzer.core.exception;

/**
 * 피드 후보가 실제 피드가 아님
 */
public class FeedValidationException extends AnalysisException {

    public FeedValidationException(String message, String url) {
        super(ErrorKind.VALIDATION, message, url);
    }

    public FeedValidationException(String message, String url, Throwable cause) {
        super(ErrorKind.VALIDATION, message, url, cause);
    }

    public static FeedValidationException notAFeed(String url, Throwable cause) {
        return new FeedValidationException("not a feed: " + url, url, cause);
    }

    public static FeedValidationException httpStatus(String url, int status) {
        return new FeedValidationException("feed candidate returned HTTP " + status, url);
    }
}
