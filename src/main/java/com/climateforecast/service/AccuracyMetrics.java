package com.climateforecast.service;

/**
 * Out-of-sample accuracy measures. Positions where the actual (or predicted) value is missing
 * are skipped rather than imputed; MAPE additionally skips zero actuals and is NaN when nothing remains.
 */
public final class AccuracyMetrics {

    private AccuracyMetrics() {
    }

    public static Scores score(double[] actual, double[] predicted) {
        return new Scores(rmse(actual, predicted), mae(actual, predicted), mape(actual, predicted));
    }

    public static double rmse(double[] actual, double[] predicted) {
        requireSameLength(actual, predicted);
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < actual.length; i++) {
            if (present(actual[i], predicted[i])) {
                double err = actual[i] - predicted[i];
                sum += err * err;
                count++;
            }
        }
        return count == 0 ? Double.NaN : Math.sqrt(sum / count);
    }

    public static double mae(double[] actual, double[] predicted) {
        requireSameLength(actual, predicted);
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < actual.length; i++) {
            if (present(actual[i], predicted[i])) {
                sum += Math.abs(actual[i] - predicted[i]);
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    public static double mape(double[] actual, double[] predicted) {
        requireSameLength(actual, predicted);
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < actual.length; i++) {
            if (present(actual[i], predicted[i]) && actual[i] != 0.0) {
                sum += Math.abs((actual[i] - predicted[i]) / actual[i]);
                count++;
            }
        }
        return count == 0 ? Double.NaN : (sum / count) * 100.0;
    }

    private static boolean present(double actual, double predicted) {
        return !Double.isNaN(actual) && !Double.isNaN(predicted);
    }

    private static void requireSameLength(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException(
                "actual and predicted differ in length: " + actual.length + " vs " + predicted.length);
        }
    }

    public record Scores(double rmse, double mae, double mape) {}
}
