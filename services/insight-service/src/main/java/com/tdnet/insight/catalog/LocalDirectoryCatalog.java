package com.tdnet.insight.catalog;

import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.disclosure.DocType;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * PDFs under a local directory named {@code {code}_{title}.pdf}. The date range is ignored. Every file
 * is treated as an earnings summary and the company name is left blank for the issuer directory to fill.
 */
public class LocalDirectoryCatalog implements DocumentCatalog {

    private final Path directory;

    public LocalDirectoryCatalog(Path directory) {
        this.directory = directory;
    }

    @Override
    public List<Disclosure> load(List<String> dates) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Local directory does not exist: " + directory);
        }
        try (Stream<Path> files = Files.walk(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                .sorted()
                .map(LocalDirectoryCatalog::toDisclosure)
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + directory, e);
        }
    }

    @Override
    public boolean isLocal() {
        return true;
    }

    static Disclosure toDisclosure(Path file) {
        String fileName = file.getFileName().toString();
        int underscore = fileName.indexOf('_');
        String code = underscore >= 0 ? fileName.substring(0, underscore) : stripExtension(fileName);
        String title = underscore >= 0 ? stripExtension(fileName.substring(underscore + 1)) : fileName;
        return new Disclosure("", code, "", title, DocType.TANSHIN, null, file.toAbsolutePath().toString());
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
