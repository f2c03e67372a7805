package com.tdnet.ingestion.client;

import java.nio.file.Path;

public interface DocumentDownloader {

    /**
     * Streams the document at {@code url} into {@code target}, replacing its contents.
     *
     * @throws IllegalStateException on a non-2xx response, timeout or I/O failure
     */
    void download(String url, Path target);
}
