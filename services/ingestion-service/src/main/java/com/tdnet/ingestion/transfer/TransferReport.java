package com.tdnet.ingestion.transfer;

import com.tdnet.common.disclosure.Disclosure;
import java.util.List;

public record TransferReport(
    int processed,
    int succeeded,
    int failed,
    List<TransferOutcome> outcomes
) {
    public static TransferReport empty() {
        return new TransferReport(0, 0, 0, List.of());
    }

    public List<Disclosure> stored() {
        return outcomes.stream()
            .filter(TransferOutcome::success)
            .map(TransferOutcome::disclosure)
            .toList();
    }
}
