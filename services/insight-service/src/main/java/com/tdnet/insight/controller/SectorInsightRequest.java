package com.tdnet.insight.controller;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record SectorInsightRequest(
    @NotNull @Pattern(regexp = "\\d{8}", message = "must be yyyyMMdd") String date
) {
}
