package com.pageanalyzer.core.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 날짜 문자열 → Instant.
 * - {@link #parse(String)}: 메타/헤더/속성값 같은 구조화된 값 (ISO-8601, RFC-1123)
 * - {@link #findInText(String)}: 본문 텍스트에서 날짜처럼 생긴 조각 탐색 (최후 수단)
 * 시간대가 없으면 UTC 로 간주한다.
 */
public final class DateParsing {
    private DateParsing() {}

    private static final Pattern ISO_IN_TEXT = Pattern.compile(
            "(?<!\\d)((?:19|20)\\d{2})-(0[1-9]|1[0-2])-(0[1-9]|[12]\\d|3[01])(?!\\d)");

    private static final Pattern MONTH_FIRST = Pattern.compile(
            "\\b(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Sept|Oct|Nov|Dec)[a-z]*\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+((?:19|20)\\d{2})\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DAY_FIRST = Pattern.compile(
            "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Sept|Oct|Nov|Dec)[a-z]*\\.?,?\\s+((?:19|20)\\d{2})\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("oct", 10), Map.entry("nov", 11),
            Map.entry("dec", 12));

    /** 구조화된 날짜 값 파싱. 실패 시 empty */
    public static Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String s = raw.trim();

        try {
            return Optional.of(OffsetDateTime.parse(s).toInstant());
        } catch (DateTimeParseException ignore) {
            // 다음 형식 시도
        }
        try {
            return Optional.of(Instant.parse(s));
        } catch (DateTimeParseException ignore) {
            // 다음 형식 시도
        }
        try {
            return Optional.of(ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        } catch (DateTimeParseException ignore) {
            // 다음 형식 시도
        }
        try {
            return Optional.of(LocalDateTime.parse(s.replace(' ', 'T')).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignore) {
            // 다음 형식 시도
        }
        // "+0000" 처럼 콜론 없는 오프셋
        try {
            return Optional.of(OffsetDateTime.parse(s, DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ", Locale.ROOT)).toInstant());
        } catch (DateTimeParseException ignore) {
            // 다음 형식 시도
        }
        if (s.length() >= 10) {
            try {
                return Optional.of(LocalDate.parse(s.substring(0, 10)).atStartOfDay().toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException ignore) {
                // 날짜 아님
            }
        }
        return Optional.empty();
    }

    /** 본문에서 첫 번째 날짜 모양 조각 (ISO → "Jan 5, 2024" → "5 January 2024") */
    public static Optional<Instant> findInText(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        Matcher m = ISO_IN_TEXT.matcher(text);
        if (m.find()) {
            Optional<Instant> d = toInstant(m.group(1), m.group(2), m.group(3));
            if (d.isPresent()) return d;
        }
        m = MONTH_FIRST.matcher(text);
        if (m.find()) {
            Optional<Instant> d = toInstant(m.group(3), month(m.group(1)), m.group(2));
            if (d.isPresent()) return d;
        }
        m = DAY_FIRST.matcher(text);
        if (m.find()) {
            return toInstant(m.group(3), month(m.group(2)), m.group(1));
        }
        return Optional.empty();
    }

    private static String month(String name) {
        Integer n = MONTHS.get(name.toLowerCase(Locale.ROOT));
        return n == null ? null : String.valueOf(n);
    }

    private static Optional<Instant> toInstant(String y, String mo, String d) {
        if (y == null || mo == null || d == null) return Optional.empty();
        try {
            LocalDate date = LocalDate.of(Integer.parseInt(y), Integer.parseInt(mo), Integer.parseInt(d));
            return Optional.of(date.atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeException | NumberFormatException e) {
            return Optional.empty();
        }
    }
}
