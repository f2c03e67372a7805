package com.tdnet.ingestion.batch;

import com.tdnet.ingestion.config.ScraperProperties;
import com.tdnet.ingestion.service.ScrapeDates;
import com.tdnet.ingestion.service.ScrapeRunService;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ScrapeScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScrapeScheduler.class);

    private final ScraperProperties properties;
    private final ScrapeRunService scrapeRunService;

    public ScrapeScheduler(ScraperProperties properties, ScrapeRunService scrapeRunService) {
        this.properties = properties;
        this.scrapeRunService = scrapeRunService;
    }

    @Scheduled(cron = "${scraper.scheduler.cron:0 0 19 * * MON-FRI}", zone = "${scraper.scheduler.zone:Asia/Tokyo}")
    public void runDailyScrape() {
        if (!properties.getScheduler().isEnabled()) {
            return;
        }
        String today = ScrapeDates.format(LocalDate.now(ZoneId.of(properties.getScheduler().getZone())));
        UUID runId = scrapeRunService.startRun(List.of(today), properties.getLayout());
        LOGGER.info("Scheduled scrape for {} started as run {}", today, runId);
    }
}
