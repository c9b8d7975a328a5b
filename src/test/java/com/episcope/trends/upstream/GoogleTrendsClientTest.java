package com.episcope.trends.upstream;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GoogleTrendsClient.
 */
class GoogleTrendsClientTest {

    @Test
    void testParseRetryAfterSeconds() {
        assertEquals(Duration.ofSeconds(120), GoogleTrendsClient.parseRetryAfter("120"));
        assertEquals(Duration.ofSeconds(5), GoogleTrendsClient.parseRetryAfter(" 5 "));
    }

    @Test
    void testParseRetryAfterIgnoresMissingOrDates() {
        assertNull(GoogleTrendsClient.parseRetryAfter(null));
        assertNull(GoogleTrendsClient.parseRetryAfter(""));
        assertNull(GoogleTrendsClient.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT"));
    }
}
