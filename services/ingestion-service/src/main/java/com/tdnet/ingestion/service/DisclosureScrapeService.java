package com.tdnet.ingestion.service;

import com.tdnet.common.disclosure.Disclosure;
import com.tdnet.common.disclosure.DocType;
import com.tdnet.common.storage.LayoutMode;
import com.tdnet.ingestion.classify.DocumentClassifier;
import com.tdnet.ingestion.config.ScraperProperties;
import com.tdnet.ingestion.domain.ListingRow;
import com.tdnet.ingestion.filter.MarketFilter;
import com.tdnet.ingestion.transfer.TransferReport;
import com.tdnet.ingestion.transfer.TransferWorkerPool;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DisclosureScrapeService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DisclosureScrapeService.class);

    private final ListingPaginator paginator;
    private final DocumentClassifier classifier;
    private final MarketFilter marketFilter;
    private final TransferWorkerPool transferWorkerPool;
    private final MetadataSidecarWriter sidecarWriter;
    private final int batchSize;

    public DisclosureScrapeService(
        ListingPaginator paginator,
        DocumentClassifier classifier,
        MarketFilter marketFilter,
        TransferWorkerPool transferWorkerPool,
        MetadataSidecarWriter sidecarWriter,
        ScraperProperties properties
    ) {
        this.paginator = paginator;
        this.classifier = classifier;
        this.marketFilter = marketFilter;
        this.transferWorkerPool = transferWorkerPool;
        this.sidecarWriter = sidecarWriter;
        this.batchSize = properties.getTransfer().getBatchSize();
    }

    /**
     * Scrapes one date: paginate, classify, filter, transfer in batches, then write the metadata sidecar
     * when at least one document was stored.
     */
    public DateScrapeResult scrapeDate(String date, LayoutMode layout) {
        ScrapeDates.parse(date);
        LOGGER.info("Scraping {} (layout={})", date, layout);

        List<Disclosure> pending = new ArrayList<>();
        List<Disclosure> stored = new ArrayList<>();
        Tally tally = new Tally();

        int pages = paginator.paginate(date, rows -> {
            List<Disclosure> accepted = select(rows);
            tally.discovered += accepted.size();
            pending.addAll(accepted);
            while (pending.size() >= batchSize) {
                List<Disclosure> batch = new ArrayList<>(pending.subList(0, batchSize));
                pending.subList(0, batchSize).clear();
                runBatch(batch, date, layout, stored, tally);
            }
        });
        if (!pending.isEmpty()) {
            runBatch(new ArrayList<>(pending), date, layout, stored, tally);
            pending.clear();
        }

        String metadataKey = null;
        if (!stored.isEmpty()) {
            metadataKey = sidecarWriter.write(date, stored);
        }
        LOGGER.info("Finished {}: pages={} discovered={} stored={} failed={}",
            date, pages, tally.discovered, tally.succeeded, tally.failed);
        return new DateScrapeResult(date, pages, tally.discovered, tally.succeeded, tally.failed, metadataKey);
    }

    List<Disclosure> select(List<ListingRow> rows) {
        List<Disclosure> accepted = new ArrayList<>();
        for (ListingRow row : rows) {
            Optional<DocType> docType = classifier.classify(row.title());
            if (docType.isEmpty()) {
                continue;
            }
            if (marketFilter.isExcluded(row.code())) {
                LOGGER.debug("Excluded by market: code={} title={}", row.code(), row.title());
                continue;
            }
            accepted.add(new Disclosure(
                row.time(), row.code(), row.companyName(), row.title(), docType.get(), row.pdfUrl(), null));
        }
        return accepted;
    }

    private void runBatch(List<Disclosure> batch, String date, LayoutMode layout, List<Disclosure> stored,
                          Tally tally) {
        TransferReport report = transferWorkerPool.transfer(batch, date, layout);
        stored.addAll(report.stored());
        tally.succeeded += report.succeeded();
        tally.failed += report.failed();
    }

    private static class Tally {
        private int discovered;
        private int succeeded;
        private int failed;
    }
}
