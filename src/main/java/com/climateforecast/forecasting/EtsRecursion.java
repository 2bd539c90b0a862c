package com.climateforecast.forecasting;

import com.climateforecast.forecasting.EtsSpec.ErrorType;
import com.climateforecast.forecasting.EtsSpec.SeasonType;
import com.climateforecast.forecasting.EtsSpec.TrendType;

/**
 * State-space recursion shared by all ETS variants. Updates are written in terms of the raw
 * one-step error {@code y - mu}; additive and multiplicative error models differ only in the likelihood.
 */
final class EtsRecursion {

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);
    private static final double VARIANCE_FLOOR = 1e-10;

    private EtsRecursion() {
    }

    /** Heuristic starting states: level, trend and one seasonal index per period position. */
    static State initialState(EtsSpec spec, double[] y, int frequency) {
        int m = spec.hasSeason() ? frequency : 1;
        double[] seasonals = new double[m];
        if (!spec.hasSeason()) {
            double trend = spec.hasTrend() ? initialSlope(y) : 0.0;
            return new State(y[0] - trend, trend, seasonals);
        }

        double firstMean = mean(y, 0, m);
        double secondMean = mean(y, m, 2 * m);
        double trend = spec.hasTrend() ? (secondMean - firstMean) / m : 0.0;
        double centre = (m - 1) / 2.0;
        double sum = 0.0;
        for (int i = 0; i < m; i++) {
            double base = firstMean + trend * (i - centre);
            seasonals[i] = spec.season() == SeasonType.M ? y[i] / base : y[i] - base;
            sum += seasonals[i];
        }
        double avg = sum / m;
        for (int i = 0; i < m; i++) {
            if (spec.season() == SeasonType.M) {
                seasonals[i] /= avg;
            } else {
                seasonals[i] -= avg;
            }
        }
        double level = firstMean - trend * (centre + 1.0);
        return new State(level, trend, seasonals);
    }

    /**
     * Runs the filter over {@code y} and returns the final state with -2 log-likelihood,
     * or {@code null} when the parameters drive the states out of their admissible region.
     */
    static Pass run(EtsSpec spec, EtsParameters params, State start, double[] y) {
        double level = start.level();
        double trend = start.trend();
        double[] seasonals = start.seasonals().clone();
        int m = seasonals.length;
        double phi = spec.isDamped() ? params.phi() : 1.0;

        double sumSquares = 0.0;
        double sumLogMu = 0.0;
        for (int t = 0; t < y.length; t++) {
            double lb = level + (spec.hasTrend() ? phi * trend : 0.0);
            double s = seasonals[t % m];
            double mu = switch (spec.season()) {
                case A -> lb + s;
                case M -> lb * s;
                case N -> lb;
            };
            if (!Double.isFinite(mu)) {
                return null;
            }
            if (spec.isMultiplicative() && (mu <= 0.0 || lb <= 0.0)) {
                return null;
            }
            double raw = y[t] - mu;
            if (spec.error() == ErrorType.A) {
                sumSquares += raw * raw;
            } else {
                double rel = raw / mu;
                sumSquares += rel * rel;
                sumLogMu += Math.log(Math.abs(mu));
            }

            if (spec.season() == SeasonType.M) {
                level = lb + params.alpha() * raw / s;
                trend = phi * trend + params.beta() * raw / s;
                seasonals[t % m] = s + params.gamma() * raw / lb;
            } else {
                level = lb + params.alpha() * raw;
                trend = phi * trend + params.beta() * raw;
                if (spec.season() == SeasonType.A) {
                    seasonals[t % m] = s + params.gamma() * raw;
                }
            }
            if (spec.trend() == TrendType.N) {
                trend = 0.0;
            }
        }

        int n = y.length;
        double scale = spec.error() == ErrorType.A ? meanSquare(y) : 1.0;
        double sigma2 = Math.max(sumSquares / n, VARIANCE_FLOOR * Math.max(scale, 1.0));
        double minusTwoLogLik = n * Math.log(sigma2) + 2.0 * sumLogMu + n * (1.0 + LOG_2PI);
        if (!Double.isFinite(minusTwoLogLik)) {
            return null;
        }
        return new Pass(new State(level, trend, seasonals), sumSquares / n, minusTwoLogLik);
    }

    private static double initialSlope(double[] y) {
        int span = Math.min(y.length - 1, 4);
        return span < 1 ? 0.0 : (y[span] - y[0]) / span;
    }

    private static double mean(double[] y, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += y[i];
        }
        return sum / (to - from);
    }

    private static double meanSquare(double[] y) {
        double sum = 0.0;
        for (double v : y) {
            sum += v * v;
        }
        return sum / y.length;
    }

    record State(double level, double trend, double[] seasonals) {}

    /** {@code sigma2} is in data units for additive errors and relative for multiplicative ones. */
    record Pass(State state, double sigma2, double minusTwoLogLik) {}
}
