package com.pageanalyzer.core.exception;

/**
 * HTML/피드/JSON/XML 파싱 실패
 */
public class ContentParseException extends AnalysisException {

    public ContentParseException(String message, String url) {
        super(ErrorKind.PARSE, message, url);
    }

    public ContentParseException(String message, String url, Throwable cause) {
        super(ErrorKind.PARSE, message, url, cause);
    }

    public static ContentParseException malformedFeed(String url, Throwable cause) {
        String detail = (cause == null || cause.getMessage() == null) ? "" : ": " + cause.getMessage();
        return new ContentParseException("malformed feed" + detail, url, cause);
    }

    public static ContentParseException malformedJson(String url, Throwable cause) {
        String detail = (cause == null || cause.getMessage() == null) ? "" : ": " + firstLine(cause.getMessage());
        return new ContentParseException("malformed JSON payload" + detail, url, cause);
    }

    public static ContentParseException noContent(String url) {
        return new ContentParseException("no extractable content", url);
    }

    public static ContentParseException extractionFailed(String url, Throwable cause) {
        return new ContentParseException("HTML extraction failed: " + cause, url, cause);
    }

    private static String firstLine(String s) {
        int nl = s.indexOf('\n');
        return nl < 0 ? s : s.substring(0, nl);
    }
}
