package com.episcope.trends.service.timeframe;

import com.episcope.trends.model.MetricKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FallbackSelector.
 */
class FallbackSelectorTest {

    private final FallbackSelector selector = new FallbackSelector();
    private final TimeframeNormalizer normalizer = new TimeframeNormalizer();

    @Test
    void testAlternateTimeframes() {
        assertEquals("now 7-d", selector.alternateTimeframe(MetricKind.INTEREST_OVER_TIME));
        assertEquals("today 3-m", selector.alternateTimeframe(MetricKind.RELATED_QUERIES));
        assertEquals("today 3-m", selector.alternateTimeframe(MetricKind.RELATED_TOPICS));
        assertEquals("today 6-m", selector.alternateTimeframe(MetricKind.INTEREST_BY_REGION));
    }

    @Test
    void testAlternatesAreValidTokens() {
        for (MetricKind kind : MetricKind.values()) {
            assertTrue(normalizer.isValid(selector.alternateTimeframe(kind)), kind.getWireName());
        }
    }
}
