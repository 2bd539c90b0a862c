package com.climateforecast.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SummaryRow {
    String variable;
    String model;
    double meanRmse;
    double sdRmse;
    double meanMae;
    double sdMae;
    double meanMape;
    double sdMape;
    int folds;
    int totalFolds;
    int failedFolds;
}
