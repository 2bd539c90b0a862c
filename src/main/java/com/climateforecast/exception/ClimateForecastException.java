package com.climateforecast.exception;

import lombok.Getter;

@Getter
public abstract class ClimateForecastException extends RuntimeException {
    private final String errorCode;
    protected ClimateForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected ClimateForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
