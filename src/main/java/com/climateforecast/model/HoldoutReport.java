package com.climateforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** One table per model family, one row per variable. */
@Value
@Builder
public class HoldoutReport {
    double trainFraction;
    List<ModelTable> tables;

    @Value
    @Builder
    public static class ModelTable {
        String model;
        String displayName;
        List<HoldoutRow> rows;
    }
}
