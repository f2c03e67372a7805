package com.tdnet.ingestion.service;

public record DateScrapeResult(
    String date,
    int pagesRequested,
    int discovered,
    int succeeded,
    int failed,
    String metadataKey
) {
}
