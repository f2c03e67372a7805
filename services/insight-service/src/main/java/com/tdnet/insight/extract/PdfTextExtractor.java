package com.tdnet.insight.extract;

import com.tdnet.common.storage.ObjectStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plain text of a stored PDF. Stored objects are copied to a temp file first; the copy is deleted before
 * returning, whether or not extraction succeeded.
 */
public class PdfTextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfTextExtractor.class);

    private final ObjectStore store;
    private final Path tempDir;

    public PdfTextExtractor(ObjectStore store) {
        this(store, null);
    }

    /**
     * @param tempDir directory for downloaded copies, or {@code null} for the system default
     */
    public PdfTextExtractor(ObjectStore store, Path tempDir) {
        this.store = store;
        this.tempDir = tempDir;
    }

    public String extractObject(String key) {
        Path temp = null;
        try {
            temp = tempDir == null
                ? Files.createTempFile("tdnet-extract-", ".pdf")
                : Files.createTempFile(tempDir, "tdnet-extract-", ".pdf");
            store.download(key, temp);
            return extractFile(temp);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stage " + key + " for extraction", e);
        } finally {
            deleteQuietly(temp);
        }
    }

    public String extractFile(Path pdf) {
        try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return stripper.getText(document).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to extract text from " + pdf.getFileName(), e);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOGGER.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
