package com.tdnet.common.storage;

/**
 * Storage layouts for downloaded disclosure PDFs.
 */
public enum LayoutMode {
    /** {@code {base}/{yyyy}/{mm}/{dd}/{doc_type}/{code}_{title}.pdf} */
    DATE,
    /** {@code {base}/{yyyy}/{mm}/{dd}/{code}_{title}.pdf} */
    DATE_FLAT,
    /** {@code {base}/sectors/{sector}/{size}/{code}_{company}_{title}.pdf} */
    SECTOR
}
