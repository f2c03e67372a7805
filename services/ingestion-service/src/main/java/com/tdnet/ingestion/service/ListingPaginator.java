package com.tdnet.ingestion.service;

import com.tdnet.ingestion.client.ListingPageFetcher;
import com.tdnet.ingestion.domain.ListingPage;
import com.tdnet.ingestion.domain.ListingRow;
import com.tdnet.ingestion.parser.ListingPageParser;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Walks the listing pages of one date in order. Page 1 doubles as the existence probe, and the walk ends
 * at the first page that is missing, failed or has no data rows, so k populated pages cost k+1 requests.
 */
@Component
public class ListingPaginator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ListingPaginator.class);
    private static final int MAX_PAGES = 999;

    private final ListingPageFetcher fetcher;
    private final ListingPageParser parser;

    public ListingPaginator(ListingPageFetcher fetcher, ListingPageParser parser) {
        this.fetcher = fetcher;
        this.parser = parser;
    }

    /**
     * Hands the rows of each populated page to {@code pageConsumer} and returns the number of pages requested.
     */
    public int paginate(String date, Consumer<List<ListingRow>> pageConsumer) {
        int requested = 0;
        for (int page = 1; page <= MAX_PAGES; page++) {
            ListingPage listing = fetcher.fetch(date, page);
            requested++;
            if (!listing.isFound()) {
                if (page == 1) {
                    LOGGER.info("No listing published for {} ({})", date, listing.status());
                } else {
                    LOGGER.debug("Listing for {} ends at page {} ({})", date, page, listing.status());
                }
                return requested;
            }
            List<ListingRow> rows = parser.parse(listing.html(), listing.url());
            if (rows.isEmpty()) {
                LOGGER.debug("Listing for {} ends at empty page {}", date, page);
                return requested;
            }
            LOGGER.info("Page {} for {}: {} rows", page, date, rows.size());
            pageConsumer.accept(rows);
        }
        LOGGER.warn("Stopped paginating {} after {} pages", date, MAX_PAGES);
        return requested;
    }
}
