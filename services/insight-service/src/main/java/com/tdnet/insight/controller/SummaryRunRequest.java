package com.tdnet.insight.controller;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.List;

public record SummaryRunRequest(
    @NotNull @Pattern(regexp = "\\d{8}", message = "must be yyyyMMdd") String startDate,
    @NotNull @Pattern(regexp = "\\d{8}", message = "must be yyyyMMdd") String endDate,
    String include,
    List<String> codes,
    @Min(1) Integer maxGroups,
    String localDir
) {
}
