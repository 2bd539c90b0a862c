package com.climateforecast.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class ForecastResult {
    List<Double> mean;
    @Singular
    List<PredictionInterval> intervals;

    public int horizon() {
        return mean.size();
    }

    public double[] meanArray() {
        return mean.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public Optional<PredictionInterval> interval(int level) {
        return intervals.stream().filter(i -> i.level() == level).findFirst();
    }
}
