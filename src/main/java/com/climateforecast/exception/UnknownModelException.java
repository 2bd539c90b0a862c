package com.climateforecast.exception;

import java.util.Collection;

public class UnknownModelException extends ClimateForecastException {
    public UnknownModelException(String modelId, Collection<String> known) {
        super("UNKNOWN_MODEL", "Model '" + modelId + "' is not registered. Known models: " + known + ".");
    }
}
