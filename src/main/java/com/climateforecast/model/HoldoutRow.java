package com.climateforecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HoldoutRow {
    String variable;
    double rmse;
    double mae;
    double mape;
    int trainSize;
    int testSize;
    String modelSpec;
    String failureReason;
}
