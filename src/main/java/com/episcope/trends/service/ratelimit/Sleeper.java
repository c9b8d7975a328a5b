package com.episcope.trends.service.ratelimit;

import java.time.Duration;

/**
 * Elapses time on behalf of the rate limiter.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
