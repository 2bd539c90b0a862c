package com.climateforecast.forecasting;

import com.climateforecast.model.ForecastResult;

import java.util.List;

public interface FittedModel {

    /** Human-readable form of the selected model, e.g. {@code ARIMA(1,0,0)(0,1,1)[12]}. */
    String spec();

    /** Criterion the model was selected by (AIC for ARIMA, AICc for ETS). */
    double informationCriterion();

    int trainSize();

    ForecastResult forecast(int horizon, List<Integer> confidenceLevels);
}
