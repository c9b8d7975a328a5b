package com.episcope.trends.config;

import com.episcope.trends.service.ratelimit.RateLimiter;
import com.episcope.trends.service.ratelimit.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared time source and the global upstream rate limiter.
 */
@Configuration
public class TrendsConfiguration {

    private final TrendsProperties properties;

    public TrendsConfiguration(TrendsProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public RateLimiter rateLimiter(Sleeper sleeper) {
        TrendsProperties.RateLimitConfig rateLimit = properties.getRateLimit();
        return new RateLimiter(
                rateLimit.getBaseDelay(),
                rateLimit.getMaxDelay(),
                rateLimit.getInterKindDelay(),
                sleeper);
    }
}
