package com.tdnet.ingestion.controller;

import com.tdnet.ingestion.domain.RunStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ScrapeRunResponse(
    UUID runId,
    RunStatus status,
    List<String> dates,
    Instant startedAt,
    Instant completedAt,
    int discoveredCount,
    int succeededCount,
    int failedCount,
    Map<String, Integer> savedByDate,
    String errorSummary
) {
}
