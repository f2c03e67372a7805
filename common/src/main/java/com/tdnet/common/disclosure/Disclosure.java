package com.tdnet.common.disclosure;

import com.tdnet.common.issuer.IssuerCodes;

/**
 * One classified row of a TDnet listing page.
 *
 * @param time        disclosure time as shown on the listing ({@code HH:MM})
 * @param code        issuer code as shown on the listing, not normalized
 * @param pdfUrl      absolute PDF URL, or {@code null} when the row carried no link
 * @param storagePath object key once the PDF has been stored, otherwise {@code null}
 */
public record Disclosure(
    String time,
    String code,
    String companyName,
    String title,
    DocType docType,
    String pdfUrl,
    String storagePath
) {
    public Disclosure withStoragePath(String storagePath) {
        return new Disclosure(time, code, companyName, title, docType, pdfUrl, storagePath);
    }

    public String normalizedCode() {
        return IssuerCodes.normalize(code);
    }

    public boolean hasPdfUrl() {
        return pdfUrl != null && !pdfUrl.isBlank();
    }
}
