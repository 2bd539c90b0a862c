package com.climateforecast.forecasting;

import com.climateforecast.model.ForecastResult;

import java.util.List;

/**
 * A model family the evaluators can fit and forecast with. Implementations must be stateless
 * between calls: everything learned from a train segment lives in the returned {@link FittedModel}.
 */
public interface ForecastModel {

    /** Short identifier used in requests and result rows, e.g. {@code sarima}. */
    String id();

    String displayName();

    /**
     * @throws com.climateforecast.exception.FitFailureException if no usable model can be fitted
     */
    FittedModel fit(double[] train, int frequency);

    default ForecastResult forecast(FittedModel fitted, int horizon, List<Integer> confidenceLevels) {
        return fitted.forecast(horizon, confidenceLevels);
    }
}
