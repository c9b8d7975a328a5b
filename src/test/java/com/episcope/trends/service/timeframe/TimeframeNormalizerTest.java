package com.episcope.trends.service.timeframe;

import com.episcope.trends.exception.InvalidTimeframeException;
import com.episcope.trends.model.ResolvedTimeframe;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TimeframeNormalizer.
 */
class TimeframeNormalizerTest {

    private final TimeframeNormalizer normalizer = new TimeframeNormalizer();

    @Test
    void testShortTokensAreValid() {
        for (String token : TimeframeNormalizer.shortTokens().keySet()) {
            assertTrue(normalizer.isValid(token), token);
        }
        assertTrue(normalizer.isValid("today 50-y"));
        assertFalse(normalizer.isValid("today 7-y"));
    }

    @Test
    void testValidTokenIsNotConverted() {
        ResolvedTimeframe resolved = normalizer.resolve("now 7-d");

        assertEquals("now 7-d", resolved.getToken());
        assertFalse(resolved.isConverted());
        assertNull(resolved.getConversionNote());
        assertEquals("Last 7 days", resolved.getDescription());
    }

    @Test
    void testThirtyDaysConvertsToOneMonth() {
        ResolvedTimeframe resolved = normalizer.resolve("now 30-d");

        assertEquals("today 1-m", resolved.getToken());
        assertTrue(resolved.isConverted());
        assertEquals("now 30-d", resolved.getRequested());
        assertTrue(resolved.getConversionNote().startsWith("'now 30-d' was converted to 'today 1-m'"));
    }

    @Test
    void testNowConversions() {
        assertEquals("today 1-m", normalizer.convert("now 14-d"));
        assertEquals("now 7-d", normalizer.convert("now 3-d"));
        assertEquals("now 7-d", normalizer.convert("now 12-H"));
    }

    @Test
    void testTodayConvertsToNearestWindow() {
        assertEquals("today 3-m", normalizer.convert("today 2-m"));
        assertEquals("today 12-m", normalizer.convert("today 9-m"));
        assertEquals("today 12-m", normalizer.convert("today 24-m"));
        assertEquals("today 5-y", normalizer.convert("today 3-y"));
        assertEquals("today 10-y", normalizer.convert("today 9-y"));
    }

    @Test
    void testTenDayRangeIsValid() {
        assertTrue(normalizer.isValid("2024-01-01:2024-01-11"));
        assertTrue(normalizer.isValid("2024-01-01 2024-01-11"));
        assertEquals("2024-01-01 2024-01-11", normalizer.toUpstreamToken("2024-01-01:2024-01-11"));
    }

    @Test
    void testRangeSeparatorIsCanonical() {
        ResolvedTimeframe spaced = normalizer.resolve("2024-01-01  2024-01-11");
        ResolvedTimeframe colon = normalizer.resolve("2024-01-01:2024-01-11");

        assertEquals("2024-01-01:2024-01-11", spaced.getToken());
        assertFalse(spaced.isConverted());
        assertEquals(colon.getToken(), spaced.getToken());
        assertEquals("2024-01-01:2024-01-11", normalizer.convert("2024-01-01 2024-01-11"));
    }

    @Test
    void testHugeCountsConvertWithoutOverflow() {
        assertEquals("today 1-m", normalizer.convert("now 99999999999-d"));
        assertEquals("now 7-d", normalizer.convert("now 99999999999-H"));
        assertEquals("today 50-y", normalizer.convert("today 99999999999999999999-y"));
        assertEquals("today 50-y", normalizer.convert("today 9223372036854775807-m"));
        assertEquals("today 50-y", normalizer.convert("today 1000000-y"));

        ResolvedTimeframe resolved = normalizer.resolve("now 99999999999-d");
        assertEquals("today 1-m", resolved.getToken());
        assertTrue(resolved.isConverted());
    }

    @Test
    void testFourHundredDayRangeIsConverted() {
        assertFalse(normalizer.isValid("2023-01-01:2024-02-05"));

        ResolvedTimeframe resolved = normalizer.resolve("2023-01-01:2024-02-05");
        assertEquals("today 12-m", resolved.getToken());
        assertTrue(resolved.getReason().contains("400 days"));
    }

    @Test
    void testReversedRangeConvertsToWeek() {
        assertEquals("now 7-d", normalizer.convert("2024-02-01:2024-01-01"));
    }

    @Test
    void testMonthRangeCoversWholeMonths() {
        assertTrue(normalizer.isValid("2024-01:2024-03"));
        assertEquals("2024-01-01 2024-03-31", normalizer.toUpstreamToken("2024-01:2024-03"));
    }

    @Test
    void testGarbageConvertsToDefault() {
        assertEquals("today 1-m", normalizer.convert("yesterday"));
        assertEquals("today 1-m", normalizer.convert("2024-13-45:2024-14-01"));
    }

    @Test
    void testBlankTimeframeIsRejected() {
        assertThrows(InvalidTimeframeException.class, () -> normalizer.resolve(" "));
        assertThrows(InvalidTimeframeException.class, () -> normalizer.resolve(null));
    }

    @Test
    void testDescriptions() {
        assertEquals("Last 5 years", normalizer.describe("today 5-y"));
        assertEquals("From January 01, 2024 to January 11, 2024", normalizer.describe("2024-01-01:2024-01-11"));
        assertEquals("Custom timeframe: whenever", normalizer.describe("whenever"));
    }
}
