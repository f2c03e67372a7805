package com.tdnet.ingestion.transfer;

import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.issuer.IssuerDirectory;
import com.tdnet.common.storage.LayoutMode;
import com.tdnet.common.storage.ObjectStore;
import com.tdnet.common.storage.PathNamer;
import com.tdnet.ingestion.client.DocumentDownloader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads a batch of disclosures and re-uploads them to the object store with bounded parallelism.
 * Items are independent: a failed download or upload is reported and the rest of the batch continues.
 */
public class TransferWorkerPool {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransferWorkerPool.class);
    private static final int PROGRESS_EVERY = 10;

    private final DocumentDownloader downloader;
    private final ObjectStore objectStore;
    private final PathNamer pathNamer;
    private final IssuerDirectory issuers;
    private final RateLimiter rateLimiter;
    private final int maxWorkers;
    private final Path tempDir;

    public TransferWorkerPool(
        DocumentDownloader downloader,
        ObjectStore objectStore,
        PathNamer pathNamer,
        IssuerDirectory issuers,
        RateLimiter rateLimiter,
        int maxWorkers,
        Path tempDir
    ) {
        this.downloader = downloader;
        this.objectStore = objectStore;
        this.pathNamer = pathNamer;
        this.issuers = issuers;
        this.rateLimiter = rateLimiter;
        this.maxWorkers = maxWorkers;
        this.tempDir = tempDir;
    }

    /**
     * Transfers every item of {@code batch}; outcomes are returned in batch order.
     */
    public TransferReport transfer(List<Disclosure> batch, String date, LayoutMode layout) {
        if (batch == null || batch.isEmpty()) {
            return TransferReport.empty();
        }
        int total = batch.size();
        int poolSize = Math.max(1, Math.min(maxWorkers, total));
        LOGGER.info("Transferring {} documents for {} with {} workers", total, date, poolSize);

        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<IndexedOutcome> completion = new ExecutorCompletionService<>(pool);
        TransferOutcome[] outcomes = new TransferOutcome[total];
        int succeeded = 0;
        int failed = 0;
        try {
            for (int i = 0; i < total; i++) {
                int index = i;
                Disclosure disclosure = batch.get(i);
                completion.submit(() -> new IndexedOutcome(index, transferOne(disclosure, date, layout)));
            }
            for (int processed = 1; processed <= total; processed++) {
                Future<IndexedOutcome> future = completion.take();
                TransferOutcome outcome;
                try {
                    IndexedOutcome indexed = future.get();
                    outcome = indexed.outcome();
                    outcomes[indexed.index()] = outcome;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOGGER.error("Transfer task crashed: {}", cause.getMessage(), cause);
                    failed++;
                    continue;
                }
                if (outcome.success()) {
                    succeeded++;
                    LOGGER.info("[{}/{}] stored code={} type={} -> {}", processed, total,
                        outcome.disclosure().code(), outcome.disclosure().docType().wireName(), outcome.message());
                } else {
                    failed++;
                    LOGGER.warn("[{}/{}] failed code={} title=\"{}\": {}", processed, total,
                        outcome.disclosure().code(), abbreviate(outcome.disclosure().title()), outcome.message());
                }
                if (processed % PROGRESS_EVERY == 0 && processed < total) {
                    LOGGER.info("Progress {}/{} (succeeded={}, failed={})", processed, total, succeeded, failed);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Transfer for {} interrupted after {} of {} items", date, succeeded + failed, total);
        } finally {
            pool.shutdownNow();
        }

        List<TransferOutcome> ordered = Arrays.stream(outcomes).filter(Objects::nonNull).toList();
        LOGGER.info("Transfer complete for {}: processed={} succeeded={} failed={}",
            date, succeeded + failed, succeeded, failed);
        return new TransferReport(succeeded + failed, succeeded, failed, ordered);
    }

    TransferOutcome transferOne(Disclosure disclosure, String date, LayoutMode layout) {
        if (!disclosure.hasPdfUrl()) {
            return TransferOutcome.failed(disclosure, "no PDF link on listing row");
        }
        Path temp = null;
        try {
            rateLimiter.acquire();
            temp = tempDir == null
                ? Files.createTempFile("tdnet-", ".pdf")
                : Files.createTempFile(tempDir, "tdnet-", ".pdf");
            downloader.download(disclosure.pdfUrl(), temp);
            String key = pathNamer.documentKey(disclosure, date, layout, issuers.resolve(disclosure.code()));
            String location = objectStore.put(key, temp);
            return TransferOutcome.stored(disclosure.withStoragePath(key), location);
        } catch (IOException | RuntimeException ex) {
            return TransferOutcome.failed(disclosure, ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        } finally {
            deleteTemp(temp);
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOGGER.warn("Could not delete temp file {}: {}", temp, e.getMessage());
        }
    }

    private static String abbreviate(String title) {
        if (title == null) {
            return "";
        }
        return title.length() <= 50 ? title : title.substring(0, 50) + "...";
    }

    private record IndexedOutcome(int index, TransferOutcome outcome) {
    }
}
