package com.tdnet.common.storage;

import java.nio.file.Path;
import java.util.List;

/**
 * Hierarchical key/value store the pipeline writes PDFs and artifacts to. Keys use {@code /} separators.
 */
public interface ObjectStore {

    /**
     * Uploads a local file under {@code key} and returns a printable location (URI or absolute path).
     */
    String put(String key, Path source);

    String putText(String key, String text, String contentType);

    void download(String key, Path target);

    String readText(String key);

    /**
     * Keys starting with {@code prefix}, sorted.
     */
    List<String> list(String prefix);

    boolean exists(String key);
}
