package com.episcope.trends.service.timeframe;

import com.episcope.trends.exception.InvalidTimeframeException;
import com.episcope.trends.model.ResolvedTimeframe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates timeframe tokens and converts invalid ones to the nearest valid token.
 *
 * Valid tokens are the short forms in {@link #SHORT_TOKENS} or literal date ranges
 * {@code YYYY-MM-DD:YYYY-MM-DD} / {@code YYYY-MM:YYYY-MM} spanning 1 to 365 days.
 */
@Slf4j
@Component
public class TimeframeNormalizer {

    public static final String DEFAULT_TOKEN = "today 1-m";

    private static final int MIN_RANGE_DAYS = 1;
    private static final int MAX_RANGE_DAYS = 365;
    private static final int MAX_COUNT_DIGITS = 6;
    private static final long MAX_COUNT = 1_000_000L;

    private static final Map<String, String> SHORT_TOKENS;

    static {
        Map<String, String> tokens = new LinkedHashMap<>();
        tokens.put("now 1-H", "Last hour");
        tokens.put("now 4-H", "Last 4 hours");
        tokens.put("now 1-d", "Last 24 hours");
        tokens.put("now 7-d", "Last 7 days");
        tokens.put("today 1-m", "Last month");
        tokens.put("today 3-m", "Last 3 months");
        tokens.put("today 6-m", "Last 6 months");
        tokens.put("today 12-m", "Last 12 months");
        for (int years = 5; years <= 50; years += 5) {
            tokens.put("today " + years + "-y", "Last " + years + " years");
        }
        SHORT_TOKENS = Collections.unmodifiableMap(tokens);
    }

    private static final Pattern NOW_PATTERN = Pattern.compile("^now (\\d+)-([dH])$");
    private static final Pattern TODAY_PATTERN = Pattern.compile("^today (\\d+)-([my])$");
    private static final Pattern RANGE_PATTERN =
            Pattern.compile("^(\\d{4}-\\d{2}(?:-\\d{2})?)[ :](\\d{4}-\\d{2}(?:-\\d{2})?)$");

    private static final DateTimeFormatter DESCRIPTION_DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

    /**
     * Resolve a requested token, converting it when invalid.
     *
     * @throws InvalidTimeframeException when the token is blank
     */
    public ResolvedTimeframe resolve(String requested) {
        if (requested == null || requested.isBlank()) {
            throw new InvalidTimeframeException("Timeframe is required. Valid options: " + String.join(", ", SHORT_TOKENS.keySet()));
        }
        String token = clean(requested);
        String error = validationError(token);
        if (error == null) {
            return ResolvedTimeframe.builder()
                    .token(token)
                    .requested(requested)
                    .converted(false)
                    .description(describe(token))
                    .build();
        }

        String converted = convert(token);
        log.warn("Invalid timeframe '{}' converted to '{}'. {}", requested, converted, error);
        return ResolvedTimeframe.builder()
                .token(converted)
                .requested(requested)
                .converted(true)
                .reason(error)
                .description(describe(converted))
                .build();
    }

    public boolean isValid(String token) {
        return token != null && validationError(clean(token)) == null;
    }

    /**
     * Why a token is invalid, or null when it is valid.
     */
    String validationError(String token) {
        if (SHORT_TOKENS.containsKey(token)) {
            return null;
        }

        DateRange range = parseRange(token);
        if (range != null) {
            long days = range.days();
            if (days >= MIN_RANGE_DAYS && days <= MAX_RANGE_DAYS) {
                return null;
            }
            return "Date range too " + (days < MIN_RANGE_DAYS ? "short" : "long") + " (" + days + " days). Use 1-365 days.";
        }

        if (token.startsWith("now 30-d")) {
            return "Use 'today 1-m' for last 30 days or 'today 3-m' for better data quality.";
        }
        if (token.startsWith("now")) {
            return "Invalid 'now' timeframe. Use 'today' timeframes for periods longer than 7 days.";
        }
        return "Invalid timeframe. Valid options: now 1-H, now 4-H, now 1-d, now 7-d, today 1-m...";
    }

    /**
     * Nearest valid token for an invalid one. Valid tokens are returned unchanged.
     */
    public String convert(String requested) {
        String token = clean(requested);
        if (validationError(token) == null) {
            return token;
        }

        Matcher now = NOW_PATTERN.matcher(token);
        if (now.matches()) {
            if ("H".equals(now.group(2))) {
                return "now 7-d";
            }
            return boundedCount(now.group(1)) > 7 ? "today 1-m" : "now 7-d";
        }

        Matcher today = TODAY_PATTERN.matcher(token);
        if (today.matches()) {
            long months = boundedCount(today.group(1)) * ("y".equals(today.group(2)) ? 12 : 1);
            return nearestWindow(months);
        }

        DateRange range = parseRange(token);
        if (range != null) {
            return range.days() > MAX_RANGE_DAYS ? "today 12-m" : "now 7-d";
        }

        return DEFAULT_TOKEN;
    }

    public String describe(String token) {
        String description = SHORT_TOKENS.get(token);
        if (description != null) {
            return description;
        }
        DateRange range = parseRange(token);
        if (range != null) {
            return "From " + range.start.format(DESCRIPTION_DATE) + " to " + range.end.format(DESCRIPTION_DATE);
        }
        return "Custom timeframe: " + token;
    }

    /**
     * Token in the form the upstream expects: literal ranges become "start end" dates.
     */
    public String toUpstreamToken(String token) {
        DateRange range = parseRange(token);
        if (range == null) {
            return token;
        }
        return range.start + " " + range.end;
    }

    public static Map<String, String> shortTokens() {
        return SHORT_TOKENS;
    }

    /**
     * Whitespace collapsed; literal ranges always use ':' so equal ranges share a cache key.
     */
    private static String clean(String token) {
        String cleaned = token.trim().replaceAll("\\s+", " ");
        Matcher range = RANGE_PATTERN.matcher(cleaned);
        return range.matches() ? range.group(1) + ":" + range.group(2) : cleaned;
    }

    /**
     * Numeric part of a relative token. Counts beyond the longest window are capped.
     */
    private static long boundedCount(String digits) {
        return digits.length() > MAX_COUNT_DIGITS ? MAX_COUNT : Long.parseLong(digits);
    }

    /**
     * Closest "today" window by month count; ties go to the longer window.
     */
    private static String nearestWindow(long months) {
        String best = DEFAULT_TOKEN;
        long bestDistance = Long.MAX_VALUE;
        for (String token : SHORT_TOKENS.keySet()) {
            Matcher m = TODAY_PATTERN.matcher(token);
            if (!m.matches()) {
                continue;
            }
            long windowMonths = Long.parseLong(m.group(1)) * ("y".equals(m.group(2)) ? 12 : 1);
            long distance = Math.abs(windowMonths - months);
            if (distance <= bestDistance) {
                best = token;
                bestDistance = distance;
            }
        }
        return best;
    }

    private static DateRange parseRange(String token) {
        Matcher m = RANGE_PATTERN.matcher(token);
        if (!m.matches()) {
            return null;
        }
        try {
            return new DateRange(parseDate(m.group(1), false), parseDate(m.group(2), true));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable date range '{}': {}", token, e.getMessage());
            return null;
        }
    }

    private static LocalDate parseDate(String value, boolean endOfPeriod) {
        if (value.length() == 7) {
            YearMonth month = YearMonth.parse(value);
            return endOfPeriod ? month.atEndOfMonth() : month.atDay(1);
        }
        return LocalDate.parse(value);
    }

    private static final class DateRange {
        private final LocalDate start;
        private final LocalDate end;

        private DateRange(LocalDate start, LocalDate end) {
            this.start = start;
            this.end = end;
        }

        long days() {
            return ChronoUnit.DAYS.between(start, end);
        }
    }
}
