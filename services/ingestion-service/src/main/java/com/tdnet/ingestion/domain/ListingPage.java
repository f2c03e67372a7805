package com.tdnet.ingestion.domain;

/**
 * Result of fetching one listing page. Neither {@link Status#ABSENT} nor {@link Status#FAILED} is fatal;
 * both end pagination for the date.
 */
public record ListingPage(
    Status status,
    String url,
    int httpStatus,
    String html
) {
    public enum Status {
        FOUND,
        ABSENT,
        FAILED
    }

    public static ListingPage found(String url, int httpStatus, String html) {
        return new ListingPage(Status.FOUND, url, httpStatus, html == null ? "" : html);
    }

    public static ListingPage absent(String url, int httpStatus) {
        return new ListingPage(Status.ABSENT, url, httpStatus, "");
    }

    public static ListingPage failed(String url) {
        return new ListingPage(Status.FAILED, url, 0, "");
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
