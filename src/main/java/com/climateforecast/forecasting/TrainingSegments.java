package com.climateforecast.forecasting;

import com.climateforecast.exception.FitFailureException;

final class TrainingSegments {

    private TrainingSegments() {
    }

    static void requireFittable(double[] train, String model, int minLength) {
        if (train.length < minLength) {
            throw new FitFailureException(model + ": train segment of " + train.length
                + " points is too short (needs at least " + minLength + ")");
        }
        double first = train[0];
        boolean constant = true;
        for (double v : train) {
            if (Double.isNaN(v)) {
                throw new FitFailureException(model + ": train segment contains missing values");
            }
            if (v != first) {
                constant = false;
            }
        }
        if (constant) {
            throw new FitFailureException(model + ": train segment is constant");
        }
    }

    static boolean strictlyPositive(double[] values) {
        for (double v : values) {
            if (v <= 0.0) {
                return false;
            }
        }
        return true;
    }

    static double[] difference(double[] values, int lag) {
        if (values.length <= lag) {
            return new double[0];
        }
        double[] out = new double[values.length - lag];
        for (int i = lag; i < values.length; i++) {
            out[i - lag] = values[i] - values[i - lag];
        }
        return out;
    }
}
