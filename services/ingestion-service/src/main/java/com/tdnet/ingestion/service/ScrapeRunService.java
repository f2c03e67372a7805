package com.tdnet.ingestion.service;

import com.tdnet.common.storage.LayoutMode;
import com.tdnet.ingestion.domain.ScrapeRun;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs scrapes in the background, one run at a time, and keeps their state in memory.
 */
@Service
public class ScrapeRunService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScrapeRunService.class);
    private static final int MAX_ERROR_LENGTH = 400;

    private final DisclosureScrapeService scrapeService;
    private final ConcurrentHashMap<UUID, ScrapeRun> runs = new ConcurrentHashMap<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "scrape-run");
        thread.setDaemon(true);
        return thread;
    });

    public ScrapeRunService(DisclosureScrapeService scrapeService) {
        this.scrapeService = scrapeService;
    }

    public UUID startRun(List<String> dates, LayoutMode layout) {
        if (dates == null || dates.isEmpty()) {
            throw new IllegalArgumentException("At least one date is required");
        }
        dates.forEach(ScrapeDates::parse);

        ScrapeRun run = new ScrapeRun(UUID.randomUUID(), dates);
        runs.put(run.getRunId(), run);
        LOGGER.info("Queued scrape run {} for {} date(s) {}..{}", run.getRunId(), dates.size(),
            dates.get(0), dates.get(dates.size() - 1));
        executor.submit(() -> execute(run, layout));
        return run.getRunId();
    }

    public Optional<ScrapeRun> getRun(UUID runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    void execute(ScrapeRun run, LayoutMode layout) {
        run.start();
        try {
            for (String date : run.getDates()) {
                try {
                    DateScrapeResult result = scrapeService.scrapeDate(date, layout);
                    run.addDiscovered(result.discovered());
                    run.addTransferred(result.succeeded(), result.failed());
                    run.recordDate(date, result.succeeded());
                } catch (RuntimeException ex) {
                    LOGGER.error("Scrape of {} failed in run {}: {}", date, run.getRunId(), ex.getMessage(), ex);
                    run.recordDate(date, -1);
                }
            }
            run.complete();
            LOGGER.info("Scrape run {} finished with status {} ({})", run.getRunId(), run.getStatus(),
                run.getSavedByDate());
        } catch (RuntimeException fatal) {
            LOGGER.error("Scrape run {} failed", run.getRunId(), fatal);
            run.fail(truncate(fatal.getMessage()));
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private String truncate(String text) {
        if (text == null || text.isBlank()) {
            return "unknown";
        }
        return text.length() <= MAX_ERROR_LENGTH ? text : text.substring(0, MAX_ERROR_LENGTH);
    }
}
