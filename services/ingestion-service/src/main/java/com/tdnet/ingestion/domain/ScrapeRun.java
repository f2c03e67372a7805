package com.tdnet.ingestion.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory record of one scrape run. Counters are updated by the run thread and read by the API.
 */
public class ScrapeRun {

    private final UUID runId;
    private final List<String> dates;
    private final Instant startedAt;
    private volatile RunStatus status;
    private volatile Instant completedAt;
    private volatile String errorSummary;
    private final Map<String, Integer> savedByDate = Collections.synchronizedMap(new LinkedHashMap<>());
    private int discoveredCount;
    private int succeededCount;
    private int failedCount;

    public ScrapeRun(UUID runId, List<String> dates) {
        this.runId = runId;
        this.dates = List.copyOf(dates);
        this.startedAt = Instant.now();
        this.status = RunStatus.QUEUED;
    }

    public void start() {
        this.status = RunStatus.RUNNING;
    }

    public synchronized void addDiscovered(int count) {
        discoveredCount += count;
    }

    public synchronized void addTransferred(int succeeded, int failed) {
        succeededCount += succeeded;
        failedCount += failed;
    }

    public void recordDate(String date, int saved) {
        savedByDate.put(date, saved);
    }

    public void complete() {
        boolean anyDateFailed;
        synchronized (savedByDate) {
            anyDateFailed = savedByDate.containsValue(-1);
        }
        synchronized (this) {
            this.status = anyDateFailed || failedCount > 0 ? RunStatus.PARTIAL_SUCCESS : RunStatus.SUCCEEDED;
        }
        this.completedAt = Instant.now();
    }

    public void fail(String errorSummary) {
        this.status = RunStatus.FAILED;
        this.errorSummary = errorSummary;
        this.completedAt = Instant.now();
    }

    public UUID getRunId() {
        return runId;
    }

    public List<String> getDates() {
        return dates;
    }

    public RunStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getErrorSummary() {
        return errorSummary;
    }

    public Map<String, Integer> getSavedByDate() {
        synchronized (savedByDate) {
            return new LinkedHashMap<>(savedByDate);
        }
    }

    public synchronized int getDiscoveredCount() {
        return discoveredCount;
    }

    public synchronized int getSucceededCount() {
        return succeededCount;
    }

    public synchronized int getFailedCount() {
        return failedCount;
    }
}
