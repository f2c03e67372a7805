package com.tdnet.insight.service;

import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.storage.ObjectStore;
import com.tdnet.common.storage.PathNamer;
import com.tdnet.insight.catalog.DocumentCatalog;
import com.tdnet.insight.catalog.LocalDirectoryCatalog;
import com.tdnet.insight.extract.PdfTextExtractor;
import com.tdnet.insight.grouping.DocumentGroup;
import com.tdnet.insight.grouping.DocumentGrouper;
import com.tdnet.insight.grouping.GroupingFilter;
import com.tdnet.insight.summarize.PromptTemplates;
import com.tdnet.insight.summarize.RetryingSummarizer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-issuer summaries for a date range. All text extraction finishes before the first summarization
 * call; each issuer's summary is written under the last date of the range.
 */
public class CompanySummaryService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompanySummaryService.class);
    static final String MARKDOWN = "text/markdown; charset=utf-8";

    private final DocumentCatalog metadataCatalog;
    private final DocumentGrouper grouper;
    private final PdfTextExtractor extractor;
    private final RetryingSummarizer summarizer;
    private final PromptTemplates templates;
    private final ObjectStore store;
    private final PathNamer namer;
    private final BoundedParallelRunner runner;

    public CompanySummaryService(
        DocumentCatalog metadataCatalog,
        DocumentGrouper grouper,
        PdfTextExtractor extractor,
        RetryingSummarizer summarizer,
        PromptTemplates templates,
        ObjectStore store,
        PathNamer namer,
        BoundedParallelRunner runner
    ) {
        this.metadataCatalog = metadataCatalog;
        this.grouper = grouper;
        this.extractor = extractor;
        this.summarizer = summarizer;
        this.templates = templates;
        this.store = store;
        this.namer = namer;
        this.runner = runner;
    }

    /**
     * @param localDir directory of PDFs to use instead of the metadata sidecars; {@code null} reads the sidecars
     * @return keys of the summaries written, in group order
     */
    public List<String> generate(String startDate, String endDate, GroupingFilter filter, Path localDir) {
        List<String> dates = DateRange.between(startDate, endDate);
        String outputDate = dates.get(dates.size() - 1);
        DocumentCatalog catalog = catalogFor(localDir);

        List<Disclosure> documents = catalog.load(dates);
        LOGGER.info("Summaries {}..{}: {} documents from {}", startDate, endDate, documents.size(),
            catalog.isLocal() ? "local directory" : "metadata");
        List<DocumentGroup> groups = grouper.group(documents, filter);
        if (groups.isEmpty()) {
            LOGGER.info("Nothing to summarize for {}..{}", startDate, endDate);
            return List.of();
        }

        runner.runAll("extract", groups, group -> {
            group.setCombinedText(combinedText(group, catalog));
            return group;
        });

        List<DocumentGroup> ready = groups.stream()
            .filter(group -> !group.getCombinedText().isBlank())
            .toList();
        List<Optional<String>> written = runner.runAll("summarize", ready, group -> summarizeGroup(group, outputDate));

        List<String> keys = new ArrayList<>();
        written.forEach(key -> key.ifPresent(keys::add));
        LOGGER.info("Wrote {} of {} company summaries for {}", keys.size(), groups.size(), outputDate);
        return keys;
    }

    String combinedText(DocumentGroup group, DocumentCatalog catalog) {
        List<Disclosure> documents = group.getDocuments();
        List<String> parts = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            Disclosure document = documents.get(i);
            String text;
            try {
                text = catalog.isLocal()
                    ? extractor.extractFile(Path.of(document.storagePath()))
                    : extractor.extractObject(document.storagePath());
            } catch (RuntimeException ex) {
                LOGGER.error("({}/{}) extraction failed for {} \"{}\": {}", i + 1, documents.size(),
                    group.getCode(), document.title(), ex.getMessage());
                text = "--- Text extraction failed: " + document.title() + " ---\n";
            }
            parts.add("--- Document: " + document.title() + " ---\n" + text);
        }
        return String.join("\n\n", parts);
    }

    private String summarizeGroup(DocumentGroup group, String outputDate) {
        Map<String, String> values = Map.of(
            "company_code", group.getCode(),
            "company_name", group.getName(),
            "sector_name", group.getSector(),
            "titles", group.titles().stream().map(title -> "- " + title).collect(Collectors.joining("\n"))
        );
        String summary = summarizer.summarize(
            templates.companySystemPrompt(group.getSize(), values),
            templates.companyUserPrompt(values),
            group.getCombinedText());
        group.setSummary(summary);
        String key = namer.summaryKey(outputDate, group.getSector(), group.getSize(), group.getCode(), group.getName());
        store.putText(key, summary, MARKDOWN);
        LOGGER.info("Summary for {} ({}) -> {}", group.getCode(), group.getName(), key);
        return key;
    }

    private DocumentCatalog catalogFor(Path localDir) {
        return localDir == null ? metadataCatalog : new LocalDirectoryCatalog(localDir);
    }
}
