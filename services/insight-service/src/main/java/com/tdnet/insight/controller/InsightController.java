package com.tdnet.insight.controller;

import com.tdnet.insight.catalog.LocalDirectoryResolver;
import com.tdnet.insight.grouping.GroupingFilter;
import com.tdnet.insight.service.CompanySummaryService;
import com.tdnet.insight.service.SectorInsightService;
import com.tdnet.insight.service.TimeseriesAnalysisService;
import jakarta.validation.Valid;
import java.nio.file.Path;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous triggers for the insight stage. Each call returns once every artifact has been written.
 */
@RestController
@RequestMapping("/v1/insights")
public class InsightController {

    private final CompanySummaryService companySummaryService;
    private final SectorInsightService sectorInsightService;
    private final TimeseriesAnalysisService timeseriesAnalysisService;
    private final LocalDirectoryResolver localDirectories;

    public InsightController(
        CompanySummaryService companySummaryService,
        SectorInsightService sectorInsightService,
        TimeseriesAnalysisService timeseriesAnalysisService,
        LocalDirectoryResolver localDirectories
    ) {
        this.companySummaryService = companySummaryService;
        this.sectorInsightService = sectorInsightService;
        this.timeseriesAnalysisService = timeseriesAnalysisService;
        this.localDirectories = localDirectories;
    }

    @PostMapping("/summaries")
    public ArtifactsResponse summaries(@Valid @RequestBody SummaryRunRequest request) {
        GroupingFilter filter = GroupingFilter.of(request.include(), request.codes(), request.maxGroups());
        Path localDir = localDirectories.resolve(request.localDir()).orElse(null);
        return ArtifactsResponse.of(companySummaryService.generate(
            request.startDate(), request.endDate(), filter, localDir));
    }

    @PostMapping("/sectors")
    public ArtifactsResponse sectors(@Valid @RequestBody SectorInsightRequest request) {
        return ArtifactsResponse.of(sectorInsightService.generate(request.date()));
    }

    @PostMapping("/timeseries")
    public ArtifactsResponse timeseries() {
        return ArtifactsResponse.of(timeseriesAnalysisService.analyze());
    }
}
