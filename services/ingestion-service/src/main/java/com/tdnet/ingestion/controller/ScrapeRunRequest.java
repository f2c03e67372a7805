package com.tdnet.ingestion.controller;

import com.tdnet.common.storage.LayoutMode;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Pattern;

public record ScrapeRunRequest(
    @Pattern(regexp = "\\d{8}", message = "must be YYYYMMDD")
    String date,

    @Pattern(regexp = "\\d{8}", message = "must be YYYYMMDD")
    String startDate,

    @Pattern(regexp = "\\d{8}", message = "must be YYYYMMDD")
    String endDate,

    LayoutMode layout
) {
    @AssertTrue(message = "either date or both startDate and endDate must be given")
    public boolean isDateSelectionValid() {
        boolean single = date != null;
        boolean range = startDate != null && endDate != null;
        boolean partialRange = (startDate == null) != (endDate == null);
        return single != range && !partialRange;
    }
}
