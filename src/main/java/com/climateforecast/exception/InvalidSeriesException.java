package com.climateforecast.exception;

public class InvalidSeriesException extends ClimateForecastException {
    public InvalidSeriesException(String message) {
        super("INVALID_SERIES", message);
    }
}
