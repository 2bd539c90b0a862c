package com.climateforecast.model;

import com.climateforecast.exception.InvalidSeriesException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Series of several variables over the same months, in a fixed variable order. */
public final class ClimateDataset {

    private final Map<String, ClimateSeries> series;

    private ClimateDataset(Map<String, ClimateSeries> series) {
        this.series = series;
    }

    public static ClimateDataset of(List<ClimateSeries> series) {
        Map<String, ClimateSeries> byName = new LinkedHashMap<>();
        for (ClimateSeries s : series) {
            if (byName.putIfAbsent(s.getVariable(), s) != null) {
                throw new InvalidSeriesException("Variable " + s.getVariable() + " supplied more than once");
            }
        }
        return new ClimateDataset(byName);
    }

    public List<String> variables() {
        return List.copyOf(series.keySet());
    }

    public List<ClimateSeries> series() {
        return List.copyOf(series.values());
    }

    public ClimateSeries get(String variable) {
        ClimateSeries s = series.get(variable);
        if (s == null) {
            throw new InvalidSeriesException("Unknown variable '" + variable + "'. Known variables: " + series.keySet());
        }
        return s;
    }
}
