package com.climateforecast.model;

import java.util.List;

/** Lower and upper forecast bounds at one confidence level (e.g. 80 or 95). */
public record PredictionInterval(int level, List<Double> lower, List<Double> upper) {

    public PredictionInterval {
        lower = List.copyOf(lower);
        upper = List.copyOf(upper);
        if (lower.size() != upper.size()) {
            throw new IllegalArgumentException("lower and upper bounds differ in length");
        }
    }

    public boolean isCollapsed() {
        for (int i = 0; i < lower.size(); i++) {
            if (upper.get(i) - lower.get(i) > 0.0) {
                return false;
            }
        }
        return true;
    }
}
