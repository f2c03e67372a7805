package com.tdnet.ingestion.domain;

/**
 * One data row of a listing table before classification.
 */
public record ListingRow(
    String time,
    String code,
    String companyName,
    String title,
    String pdfUrl
) {
}
