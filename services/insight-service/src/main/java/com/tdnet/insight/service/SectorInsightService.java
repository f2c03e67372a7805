package com.tdnet.insight.service;

import com.tdnet.common.storage.ObjectStore;
import com.tdnet.common.storage.PathNamer;
import com.tdnet.common.storage.StorageException;
import com.tdnet.insight.summarize.PromptTemplates;
import com.tdnet.insight.summarize.RetryingSummarizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rolls one date's company summaries up into one insight per sector and size class.
 */
public class SectorInsightService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SectorInsightService.class);
    private static final String SUMMARY_SUFFIX = "_summary.md";
    static final String SUMMARY_SEPARATOR = "\n\n---\n\n";

    private final ObjectStore store;
    private final PathNamer namer;
    private final RetryingSummarizer summarizer;
    private final PromptTemplates templates;
    private final BoundedParallelRunner runner;

    public SectorInsightService(
        ObjectStore store,
        PathNamer namer,
        RetryingSummarizer summarizer,
        PromptTemplates templates,
        BoundedParallelRunner runner
    ) {
        this.store = store;
        this.namer = namer;
        this.summarizer = summarizer;
        this.templates = templates;
        this.runner = runner;
    }

    public List<String> generate(String date) {
        DateRange.parse(date);
        List<String> keys = store.list(namer.summariesPrefix(date));
        if (keys.isEmpty()) {
            LOGGER.warn("No company summaries under {}", namer.summariesPrefix(date));
            return List.of();
        }

        Map<String, SectorBucket> buckets = new LinkedHashMap<>();
        for (String key : keys) {
            Optional<String[]> parsed = parseSummaryName(key);
            if (parsed.isEmpty()) {
                LOGGER.warn("Cannot read sector and size from {}", key);
                continue;
            }
            String sector = parsed.get()[0];
            String size = parsed.get()[1];
            try {
                String content = store.readText(key);
                buckets.computeIfAbsent(sector + "_" + size, k -> new SectorBucket(sector, size))
                    .summaries().add(content);
            } catch (StorageException ex) {
                LOGGER.error("Failed to read {}: {}", key, ex.getMessage());
            }
        }
        if (buckets.isEmpty()) {
            LOGGER.error("No summary under {} could be assigned to a sector", namer.summariesPrefix(date));
            return List.of();
        }

        List<SectorBucket> work = new ArrayList<>(buckets.values());
        List<String> written = new ArrayList<>();
        runner.runAll("sector-insights", work, bucket -> writeInsight(date, bucket))
            .forEach(key -> key.ifPresent(written::add));
        LOGGER.info("Wrote {} of {} sector insights for {}", written.size(), work.size(), date);
        return written;
    }

    private String writeInsight(String date, SectorBucket bucket) {
        Map<String, String> values = Map.of(
            "sector_name", bucket.sector() + "_" + bucket.size(),
            "count", String.valueOf(bucket.summaries().size()),
            "summaries", String.join(SUMMARY_SEPARATOR, bucket.summaries())
        );
        String insight = summarizer.summarize(templates.sectorSystemPrompt(values), templates.sectorUserPrompt(values));
        String key = namer.sectorInsightKey(date, bucket.sector(), bucket.size());
        store.putText(key, insight, CompanySummaryService.MARKDOWN);
        LOGGER.info("Sector insight {}_{} ({} companies) -> {}", bucket.sector(), bucket.size(),
            bucket.summaries().size(), key);
        return key;
    }

    /**
     * {@code {date}__{sector}__{size}__{code}__{name}_summary.md} to {@code [sector, size]}.
     */
    static Optional<String[]> parseSummaryName(String key) {
        String fileName = key.substring(key.lastIndexOf('/') + 1);
        if (!fileName.endsWith(SUMMARY_SUFFIX)) {
            return Optional.empty();
        }
        String[] parts = fileName.substring(0, fileName.length() - SUMMARY_SUFFIX.length()).split("__", -1);
        if (parts.length < 5 || parts[1].isEmpty() || parts[2].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new String[] {parts[1], parts[2]});
    }

    private record SectorBucket(String sector, String size, List<String> summaries) {
        SectorBucket(String sector, String size) {
            this(sector, size, new ArrayList<>());
        }
    }
}
