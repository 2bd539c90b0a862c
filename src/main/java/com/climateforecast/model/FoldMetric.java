package com.climateforecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Accuracy of one (variable, model, origin) fold. {@code origin} is the number of training points.
 * A fold whose fit failed has NaN metrics and a {@code failureReason}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FoldMetric {
    String variable;
    String model;
    int origin;
    double rmse;
    double mae;
    double mape;
    List<Double> actual;
    List<Double> predicted;
    String modelSpec;
    String failureReason;

    public boolean isFailed() {
        return failureReason != null;
    }
}
