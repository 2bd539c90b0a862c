package com.climateforecast.exception;

/**
 * Evaluator parameters that cannot produce a meaningful split. Raised before any model is fitted.
 */
public class InvalidEvaluationConfigException extends ClimateForecastException {
    public InvalidEvaluationConfigException(String variable, String model, String message) {
        super("INVALID_EVALUATION_CONFIG",
              message + " [variable=" + variable + ", model=" + model + "]");
    }
}
