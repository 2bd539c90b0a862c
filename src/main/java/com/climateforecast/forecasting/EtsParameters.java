package com.climateforecast.forecasting;

/**
 * Smoothing parameters in their constrained space. The optimizer works on an unbounded vector
 * that {@link #fromUnbounded} maps to 0 &lt; alpha &lt; 1, 0 &lt; beta &lt; alpha,
 * 0 &lt; gamma &lt; 1 - alpha and 0.8 &lt; phi &lt; 0.98.
 */
record EtsParameters(double alpha, double beta, double gamma, double phi) {

    private static final double PHI_MIN = 0.8;
    private static final double PHI_RANGE = 0.18;
    private static final double EDGE = 1e-4;

    static EtsParameters fromUnbounded(EtsSpec spec, double[] x) {
        int i = 0;
        double alpha = clamp(logistic(x[i++]));
        double beta = spec.hasTrend() ? alpha * clamp(logistic(x[i++])) : 0.0;
        double phi = spec.isDamped() ? PHI_MIN + PHI_RANGE * logistic(x[i++]) : 1.0;
        double gamma = spec.hasSeason() ? (1.0 - alpha) * clamp(logistic(x[i])) : 0.0;
        return new EtsParameters(alpha, beta, gamma, phi);
    }

    static double[] initialGuess(EtsSpec spec) {
        double[] x = new double[spec.smoothingParameterCount()];
        int i = 0;
        x[i++] = logit(0.3);
        if (spec.hasTrend()) {
            x[i++] = logit(0.1);
        }
        if (spec.isDamped()) {
            x[i++] = 0.0;
        }
        if (spec.hasSeason()) {
            x[i] = logit(0.1);
        }
        return x;
    }

    private static double logistic(double v) {
        return 1.0 / (1.0 + Math.exp(-v));
    }

    private static double logit(double p) {
        return Math.log(p / (1.0 - p));
    }

    private static double clamp(double v) {
        return Math.min(1.0 - EDGE, Math.max(EDGE, v));
    }
}
