package com.climateforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RollingOriginReport {
    int initial;
    int horizon;
    int step;
    List<FoldMetric> folds;
    List<SummaryRow> summary;
}
