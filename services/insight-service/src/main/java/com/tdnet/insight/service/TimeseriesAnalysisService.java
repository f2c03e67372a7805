package com.tdnet.insight.service;

import com.tdnet.common.issuer.IssuerDirectory;
import com.tdnet.common.storage.ObjectStore;
import com.tdnet.common.storage.PathNamer;
import com.tdnet.insight.catalog.SectorLayoutCatalog;
import com.tdnet.insight.extract.PdfTextExtractor;
import com.tdnet.insight.sequence.QuarterSequencer;
import com.tdnet.insight.summarize.PromptTemplates;
import com.tdnet.insight.summarize.RetryingSummarizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time-series analysis over the sector layout: one trend summary per issuer with at least two filings,
 * then one trend insight per sector and size class built from those summaries.
 */
public class TimeseriesAnalysisService {

    private static final Logger LOGGER = LoggerFactory.getLogger(TimeseriesAnalysisService.class);
    static final int MIN_FILES = 2;

    private final SectorLayoutCatalog catalog;
    private final QuarterSequencer sequencer;
    private final PdfTextExtractor extractor;
    private final RetryingSummarizer summarizer;
    private final PromptTemplates templates;
    private final IssuerDirectory issuers;
    private final ObjectStore store;
    private final PathNamer namer;
    private final BoundedParallelRunner runner;

    public TimeseriesAnalysisService(
        SectorLayoutCatalog catalog,
        QuarterSequencer sequencer,
        PdfTextExtractor extractor,
        RetryingSummarizer summarizer,
        PromptTemplates templates,
        IssuerDirectory issuers,
        ObjectStore store,
        PathNamer namer,
        BoundedParallelRunner runner
    ) {
        this.catalog = catalog;
        this.sequencer = sequencer;
        this.extractor = extractor;
        this.summarizer = summarizer;
        this.templates = templates;
        this.issuers = issuers;
        this.store = store;
        this.namer = namer;
        this.runner = runner;
    }

    public List<String> analyze() {
        Map<String, Map<String, Map<String, List<String>>>> index = catalog.index();
        if (index.isEmpty()) {
            LOGGER.warn("No sector-layout files under {}", namer.sectorsPrefix());
            return List.of();
        }
        List<String> written = new ArrayList<>();
        index.forEach((sector, sizes) -> sizes.forEach((size, companies) ->
            written.addAll(analyzeBucket(sector, size, companies))));
        LOGGER.info("Time-series analysis wrote {} artifacts", written.size());
        return written;
    }

    private List<String> analyzeBucket(String sector, String size, Map<String, List<String>> companies) {
        List<CompanyFiles> eligible = new ArrayList<>();
        companies.forEach((code, files) -> {
            if (files.size() < MIN_FILES) {
                LOGGER.info("Skipping {}/{}/{}: {} file(s)", sector, size, code, files.size());
            } else {
                eligible.add(new CompanyFiles(sector, size, code, files));
            }
        });
        if (eligible.isEmpty()) {
            return List.of();
        }

        List<CompanyTrend> trends = new ArrayList<>();
        runner.runAll("timeseries " + sector + "/" + size, eligible, this::analyzeCompany)
            .forEach(trend -> trend.ifPresent(trends::add));

        List<String> written = new ArrayList<>();
        trends.forEach(trend -> written.add(trend.key()));
        if (trends.isEmpty()) {
            return written;
        }
        try {
            written.add(writeSectorTrend(sector, size, trends));
        } catch (RuntimeException ex) {
            LOGGER.error("Sector trend failed for {}/{}: {}", sector, size, ex.getMessage(), ex);
        }
        return written;
    }

    private CompanyTrend analyzeCompany(CompanyFiles company) {
        List<String> ordered = sequencer.sequence(company.files());
        List<String> documentList = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        for (String key : ordered) {
            String text;
            try {
                text = extractor.extractObject(key);
            } catch (RuntimeException ex) {
                LOGGER.error("Extraction failed for {}: {}", key, ex.getMessage());
                continue;
            }
            String fileName = key.substring(key.lastIndexOf('/') + 1);
            String label = sequencer.label(key);
            documentList.add((documentList.size() + 1) + ". **" + label + "**: " + fileName);
            texts.add("=== " + label + ": " + fileName + " ===\n" + text);
        }
        if (texts.isEmpty()) {
            LOGGER.warn("No text extracted for {}/{}/{}", company.sector(), company.size(), company.code());
            return null;
        }

        Map<String, String> values = Map.of(
            "company_code", company.code(),
            "company_name", issuers.resolve(company.code()).name(),
            "sector_name", company.sector(),
            "document_list", String.join("\n", documentList)
        );
        String summary = summarizer.summarize(
            templates.timeseriesSystemPrompt(values),
            templates.timeseriesUserPrompt(values),
            String.join("\n\n", texts));
        String key = namer.companyTimeseriesKey(company.sector(), company.size(), company.code());
        store.putText(key, summary, CompanySummaryService.MARKDOWN);
        LOGGER.info("Time-series summary {}/{}/{} ({} files) -> {}", company.sector(), company.size(),
            company.code(), texts.size(), key);
        return new CompanyTrend(company.code(), summary, key);
    }

    private String writeSectorTrend(String sector, String size, List<CompanyTrend> trends) {
        Map<String, String> values = Map.of(
            "sector_name", sector + "_" + size + "_timeseries",
            "count", String.valueOf(trends.size()),
            "summaries", String.join(SectorInsightService.SUMMARY_SEPARATOR, trends.stream().map(CompanyTrend::summary).toList())
        );
        String insight = summarizer.summarize(templates.sectorSystemPrompt(values), templates.sectorUserPrompt(values));
        String key = namer.sectorTimeseriesKey(sector, size);
        store.putText(key, insight, CompanySummaryService.MARKDOWN);
        LOGGER.info("Sector trend {}/{} ({} companies) -> {}", sector, size, trends.size(), key);
        return key;
    }

    private record CompanyFiles(String sector, String size, String code, List<String> files) {
    }

    private record CompanyTrend(String code, String summary, String key) {
    }
}
