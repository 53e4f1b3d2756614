package com.fotogeo.core.update;

import com.fotogeo.core.model.SkippedItem;

import java.util.List;

public record UpdateReport(int updatedCount, List<SkippedItem> skipped, List<RowOutcome> outcomes) {

    public UpdateReport {
        skipped = List.copyOf(skipped);
        outcomes = List.copyOf(outcomes);
    }
}
