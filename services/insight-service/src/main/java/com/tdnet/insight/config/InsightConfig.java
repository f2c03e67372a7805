package com.tdnet.insight.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tdnet.common.issuer.IssuerDirectory;
import com.tdnet.common.storage.ObjectStore;
import com.tdnet.common.storage.PathNamer;
import com.tdnet.insight.catalog.LocalDirectoryResolver;
import com.tdnet.insight.catalog.MetadataDocumentCatalog;
import com.tdnet.insight.catalog.SectorLayoutCatalog;
import com.tdnet.insight.extract.PdfTextExtractor;
import com.tdnet.insight.grouping.DocumentGrouper;
import com.tdnet.insight.sequence.QuarterSequencer;
import com.tdnet.insight.service.BoundedParallelRunner;
import com.tdnet.insight.service.CompanySummaryService;
import com.tdnet.insight.service.SectorInsightService;
import com.tdnet.insight.service.TimeseriesAnalysisService;
import com.tdnet.insight.summarize.PromptTemplates;
import com.tdnet.insight.summarize.RetryingSummarizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class InsightConfig {

    @Bean
    BoundedParallelRunner boundedParallelRunner(InsightProperties properties) {
        return new BoundedParallelRunner(properties.getLlm().getMaxWorkers());
    }

    @Bean
    PdfTextExtractor pdfTextExtractor(ObjectStore objectStore) {
        return new PdfTextExtractor(objectStore);
    }

    @Bean
    CompanySummaryService companySummaryService(
        ObjectStore objectStore,
        PathNamer pathNamer,
        IssuerDirectory issuerDirectory,
        ObjectMapper objectMapper,
        PdfTextExtractor extractor,
        RetryingSummarizer summarizer,
        PromptTemplates templates,
        BoundedParallelRunner runner
    ) {
        return new CompanySummaryService(
            new MetadataDocumentCatalog(objectStore, pathNamer, objectMapper),
            new DocumentGrouper(issuerDirectory),
            extractor,
            summarizer,
            templates,
            objectStore,
            pathNamer,
            runner
        );
    }

    @Bean
    LocalDirectoryResolver localDirectoryResolver(InsightProperties properties) {
        return new LocalDirectoryResolver(properties.getLocalDir());
    }

    @Bean
    SectorInsightService sectorInsightService(
        ObjectStore objectStore,
        PathNamer pathNamer,
        RetryingSummarizer summarizer,
        PromptTemplates templates,
        BoundedParallelRunner runner
    ) {
        return new SectorInsightService(objectStore, pathNamer, summarizer, templates, runner);
    }

    @Bean
    TimeseriesAnalysisService timeseriesAnalysisService(
        ObjectStore objectStore,
        PathNamer pathNamer,
        IssuerDirectory issuerDirectory,
        PdfTextExtractor extractor,
        RetryingSummarizer summarizer,
        PromptTemplates templates,
        BoundedParallelRunner runner
    ) {
        return new TimeseriesAnalysisService(
            new SectorLayoutCatalog(objectStore, pathNamer),
            new QuarterSequencer(),
            extractor,
            summarizer,
            templates,
            issuerDirectory,
            objectStore,
            pathNamer,
            runner
        );
    }
}
