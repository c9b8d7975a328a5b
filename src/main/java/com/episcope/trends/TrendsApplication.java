package com.episcope.trends;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the trends cache - rate-limited search interest ingestion
 * for tracked diseases.
 */
@SpringBootApplication
@EnableScheduling
public class TrendsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrendsApplication.class, args);
    }
}
