package com.tdnet.ingestion.client;

import com.tdnet.ingestion.domain.ListingPage;

public interface ListingPageFetcher {

    /**
     * Fetches listing page {@code page} (1-based) for {@code date} ({@code YYYYMMDD}). Never throws for
     * HTTP or network trouble; those come back as {@code ABSENT} or {@code FAILED}.
     */
    ListingPage fetch(String date, int page);
}
