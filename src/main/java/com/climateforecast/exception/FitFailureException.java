package com.climateforecast.exception;

/**
 * A model family could not produce a usable model or forecast for one train segment.
 * Evaluators record it against the fold instead of aborting the run.
 */
public class FitFailureException extends ClimateForecastException {
    public FitFailureException(String message) {
        super("FIT_FAILURE", message);
    }
    public FitFailureException(String message, Throwable cause) {
        super("FIT_FAILURE", message, cause);
    }
}
