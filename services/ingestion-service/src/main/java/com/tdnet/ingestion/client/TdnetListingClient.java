package com.tdnet.ingestion.client;

import com.tdnet.ingestion.config.ScraperProperties;
import com.tdnet.ingestion.domain.ListingPage;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Component
public class TdnetListingClient implements ListingPageFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(TdnetListingClient.class);

    private final WebClient webClient;
    private final String serviceRoot;
    private final Duration timeout;

    public TdnetListingClient(
        @Qualifier("tdnetListingWebClient") WebClient webClient,
        ScraperProperties properties
    ) {
        this.webClient = webClient;
        this.serviceRoot = stripTrailingSlash(properties.getServiceRoot());
        this.timeout = properties.getPageTimeout();
    }

    public String listingUrl(String date, int page) {
        return String.format("%s/I_list_%03d_%s.html", serviceRoot, page, date);
    }

    @Override
    public ListingPage fetch(String date, int page) {
        String url = listingUrl(date, page);
        try {
            ListingPage result = webClient.get()
                .uri(url)
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(html -> ListingPage.found(url, status, html));
                    }
                    return response.releaseBody().then(Mono.just(ListingPage.absent(url, status)));
                })
                .block(timeout);
            if (result == null) {
                return ListingPage.failed(url);
            }
            if (!result.isFound()) {
                LOGGER.debug("Listing page {} returned HTTP {}", url, result.httpStatus());
            }
            return result;
        } catch (RuntimeException ex) {
            LOGGER.warn("Listing page {} could not be fetched: {}", url, ex.getMessage());
            return ListingPage.failed(url);
        }
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
