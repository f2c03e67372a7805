package com.tdnet.insight.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tdnet.common.storage.LocalObjectStore;
import com.tdnet.insight.TestPdfs;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfTextExtractorTest {

    @TempDir
    Path storageRoot;

    @TempDir
    Path tempDir;

    @Test
    void extractsStoredObjectAndRemovesTheCopy() throws Exception {
        TestPdfs.write(storageRoot.resolve("tdnet/2024/01/04/tanshin/7203_report.pdf"), "Operating profit rose 12 percent");
        PdfTextExtractor extractor = new PdfTextExtractor(new LocalObjectStore(storageRoot), tempDir);

        String text = extractor.extractObject("tdnet/2024/01/04/tanshin/7203_report.pdf");

        assertThat(text).contains("Operating profit rose 12 percent");
        assertThat(listing(tempDir)).isEmpty();
    }

    @Test
    void extractsLocalFile() throws Exception {
        Path pdf = TestPdfs.write(tempDir.resolve("local/6758_summary.pdf"), "Net sales 1000");

        assertThat(new PdfTextExtractor(new LocalObjectStore(storageRoot)).extractFile(pdf)).isEqualTo("Net sales 1000");
    }

    /**
     * A file that is not a PDF fails extraction, and the downloaded copy is still cleaned up.
     */
    @Test
    void brokenPdfFailsAndStillCleansUp() throws Exception {
        Path broken = storageRoot.resolve("tdnet/broken.pdf");
        Files.createDirectories(broken.getParent());
        Files.writeString(broken, "<html>not a pdf</html>");
        PdfTextExtractor extractor = new PdfTextExtractor(new LocalObjectStore(storageRoot), tempDir);

        assertThatThrownBy(() -> extractor.extractObject("tdnet/broken.pdf"))
            .isInstanceOf(UncheckedIOException.class);
        assertThat(listing(tempDir)).isEmpty();
    }

    private static List<Path> listing(Path dir) throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.toList();
        }
    }
}
