package com.tdnet.ingestion.client;

import com.tdnet.ingestion.config.ScraperProperties;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class TdnetDocumentDownloader implements DocumentDownloader {

    private final WebClient webClient;
    private final Duration timeout;

    public TdnetDocumentDownloader(
        @Qualifier("tdnetDocumentWebClient") WebClient webClient,
        ScraperProperties properties
    ) {
        this.webClient = webClient;
        this.timeout = properties.getDownloadTimeout();
    }

    @Override
    public void download(String url, Path target) {
        try {
            webClient.get()
                .uri(url)
                .retrieve()
                .bodyToFlux(DataBuffer.class)
                .as(body -> DataBufferUtils.write(body, target,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE))
                .block(timeout);
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Download failed for " + url + ": " + ex.getMessage(), ex);
        }
    }
}
