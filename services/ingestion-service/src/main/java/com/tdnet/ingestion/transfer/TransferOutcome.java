package com.tdnet.ingestion.transfer;

import com.tdnet.common.disclosure.Disclosure;

/**
 * Per-item transfer result. On success {@code disclosure} carries its storage key.
 */
public record TransferOutcome(
    Disclosure disclosure,
    boolean success,
    String message
) {
    public static TransferOutcome stored(Disclosure disclosure, String location) {
        return new TransferOutcome(disclosure, true, location);
    }

    public static TransferOutcome failed(Disclosure disclosure, String message) {
        return new TransferOutcome(disclosure, false, message);
    }
}
