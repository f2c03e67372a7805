package com.tdnet.insight.catalog;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Confines caller-supplied PDF directories to the configured {@code insight.local-dir} root.
 * Without a configured root, only the metadata sidecars can be summarized.
 */
public class LocalDirectoryResolver {

    private final Path root;

    public LocalDirectoryResolver(String root) {
        this.root = root == null || root.isBlank() ? null : Path.of(root).toAbsolutePath().normalize();
    }

    /**
     * @param requested directory relative to the root; blank selects the root itself
     * @return the directory to read, or empty when summaries should come from the sidecars
     * @throws IllegalArgumentException when a directory is requested without a root, or it resolves outside the root
     */
    public Optional<Path> resolve(String requested) {
        if (requested == null || requested.isBlank()) {
            return Optional.ofNullable(root);
        }
        if (root == null) {
            throw new IllegalArgumentException("localDir is not accepted unless insight.local-dir is configured");
        }
        Path resolved = root.resolve(requested).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("localDir must stay under the configured local directory: " + requested);
        }
        return Optional.of(resolved);
    }
}
