package com.tdnet.ingestion.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class TdnetClientConfig {

    @Bean
    @Qualifier("tdnetListingWebClient")
    WebClient tdnetListingWebClient(ScraperProperties properties) {
        int maxBytes = Math.max(1, properties.getPageMaxInMemoryMb()) * 1024 * 1024;
        ExchangeStrategies strategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxBytes))
            .build();
        return WebClient.builder()
            .defaultHeader("User-Agent", properties.getUserAgent())
            .defaultHeader("Accept", "text/html")
            .exchangeStrategies(strategies)
            .build();
    }

    @Bean
    @Qualifier("tdnetDocumentWebClient")
    WebClient tdnetDocumentWebClient(ScraperProperties properties) {
        return WebClient.builder()
            .defaultHeader("User-Agent", properties.getUserAgent())
            .defaultHeader("Accept", "application/pdf,*/*")
            .build();
    }
}
