package com.episcope.trends.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for requests to the trends upstream.
 */
@Configuration
public class WebClientConfiguration {

    private static final int MAX_BODY_BYTES = 4 * 1024 * 1024;

    private final TrendsProperties properties;

    public WebClientConfiguration(TrendsProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getUpstream().getTimeout())
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                        .build())
                .build();
    }
}
