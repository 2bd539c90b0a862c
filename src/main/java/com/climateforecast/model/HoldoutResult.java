package com.climateforecast.model;

import com.climateforecast.forecasting.FittedModel;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one holdout run. The fitted model and forecast belong to this result only.
 */
@Value
@Builder
public class HoldoutResult {
    String variable;
    String model;
    TrainTestSplit split;
    double rmse;
    double mae;
    double mape;
    ForecastResult forecast;
    FittedModel fittedModel;
    List<Double> test;
    String failureReason;

    public boolean isFailed() {
        return failureReason != null;
    }
}
