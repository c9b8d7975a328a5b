package com.episcope.trends.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the trends cache.
 */
@Data
@Component
@ConfigurationProperties(prefix = "trends")
public class TrendsProperties {

    private List<String> entities = new ArrayList<>(List.of("Diabetes", "Malaria", "Meningitis", "Cholera"));
    private String defaultGeo = "GH";
    private StoreConfig store = new StoreConfig();
    private CacheConfig cache = new CacheConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private UpstreamConfig upstream = new UpstreamConfig();
    private WarmupConfig warmup = new WarmupConfig();

    @Data
    public static class StoreConfig {
        /**
         * "jpa" for the persistent store, "memory" for the Caffeine-backed one.
         */
        private String type = "jpa";
        private int maxSize = 10000;
        private int requestLogCapacity = 1000;
    }

    @Data
    public static class CacheConfig {
        private Duration ttl = Duration.ofHours(6);
        /**
         * Fraction of the TTL before expiry during which an entry counts as stale.
         */
        private double staleMargin = 0.25;
    }

    @Data
    public static class RateLimitConfig {
        private Duration baseDelay = Duration.ofSeconds(15);
        private Duration maxDelay = Duration.ofSeconds(60);
        private Duration interKindDelay = Duration.ofSeconds(2);
        private int maxRetries = 3;
        private Duration cooldown = Duration.ofMinutes(5);
    }

    @Data
    public static class UpstreamConfig {
        private boolean enabled = true;
        private String baseUrl = "https://trends.google.com/trends/api";
        /**
         * Page visited once per session to obtain the NID cookie the API expects.
         */
        private String cookieUrl = "https://trends.google.com/";
        private String language = "en-US";
        private int tzOffset = 0;
        private Duration timeout = Duration.ofSeconds(25);
    }

    @Data
    public static class WarmupConfig {
        private boolean enabled = false;
        private String cron = "0 0 */6 * * *";
        private List<String> timeframes = new ArrayList<>(List.of("now 7-d", "today 12-m"));
        private boolean force = false;
    }
}
