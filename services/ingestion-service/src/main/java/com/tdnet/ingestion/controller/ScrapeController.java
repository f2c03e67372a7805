package com.tdnet.ingestion.controller;

import com.tdnet.common.storage.LayoutMode;
import com.tdnet.ingestion.config.ScraperProperties;
import com.tdnet.ingestion.domain.ScrapeRun;
import com.tdnet.ingestion.service.ScrapeDates;
import com.tdnet.ingestion.service.ScrapeRunService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/scrape")
public class ScrapeController {

    private final ScrapeRunService scrapeRunService;
    private final ScraperProperties properties;

    public ScrapeController(ScrapeRunService scrapeRunService, ScraperProperties properties) {
        this.scrapeRunService = scrapeRunService;
        this.properties = properties;
    }

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(@Valid @RequestBody ScrapeRunRequest request) {
        List<String> dates = request.date() != null
            ? List.of(request.date())
            : ScrapeDates.between(request.startDate(), request.endDate());
        LayoutMode layout = request.layout() == null ? properties.getLayout() : request.layout();

        UUID runId = scrapeRunService.startRun(dates, layout);
        return ResponseEntity.accepted().body(Map.of("runId", runId));
    }

    @GetMapping("/runs/{runId}")
    public ScrapeRunResponse getRun(@PathVariable UUID runId) {
        ScrapeRun run = scrapeRunService.getRun(runId)
            .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));

        return new ScrapeRunResponse(
            run.getRunId(),
            run.getStatus(),
            run.getDates(),
            run.getStartedAt(),
            run.getCompletedAt(),
            run.getDiscoveredCount(),
            run.getSucceededCount(),
            run.getFailedCount(),
            run.getSavedByDate(),
            run.getErrorSummary()
        );
    }
}
