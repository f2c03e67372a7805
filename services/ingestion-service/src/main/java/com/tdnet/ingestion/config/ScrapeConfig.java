package com.tdnet.ingestion.config;

import com.tdnet.common.issuer.IssuerDirectory;
import com.tdnet.common.storage.ObjectStore;
import com.tdnet.common.storage.PathNamer;
import com.tdnet.ingestion.client.DocumentDownloader;
import com.tdnet.ingestion.filter.MarketFilter;
import com.tdnet.ingestion.transfer.RateLimiter;
import com.tdnet.ingestion.transfer.TransferWorkerPool;
import java.util.HashSet;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ScrapeConfig {

    @Bean
    MarketFilter marketFilter(IssuerDirectory issuerDirectory, ScraperProperties properties) {
        return new MarketFilter(issuerDirectory.markets(), new HashSet<>(properties.getExcludedMarkets()));
    }

    @Bean
    RateLimiter rateLimiter(ScraperProperties properties) {
        return new RateLimiter(properties.getRateLimit().getMaxRequestsPerSecond());
    }

    @Bean
    TransferWorkerPool transferWorkerPool(
        DocumentDownloader downloader,
        ObjectStore objectStore,
        PathNamer pathNamer,
        IssuerDirectory issuerDirectory,
        RateLimiter rateLimiter,
        ScraperProperties properties
    ) {
        return new TransferWorkerPool(
            downloader,
            objectStore,
            pathNamer,
            issuerDirectory,
            rateLimiter,
            properties.getTransfer().getMaxWorkers(),
            null
        );
    }
}
