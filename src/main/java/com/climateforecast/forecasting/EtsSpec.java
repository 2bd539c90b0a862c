package com.climateforecast.forecasting;

/**
 * One ETS(error, trend, season) configuration, printed the usual way, e.g. {@code ETS(M,Ad,A)}.
 */
record EtsSpec(ErrorType error, TrendType trend, SeasonType season) {

    enum ErrorType { A, M }

    enum TrendType {
        N("N"), A("A"), AD("Ad");

        private final String label;

        TrendType(String label) {
            this.label = label;
        }
    }

    enum SeasonType { N, A, M }

    boolean hasTrend() {
        return trend != TrendType.N;
    }

    boolean isDamped() {
        return trend == TrendType.AD;
    }

    boolean hasSeason() {
        return season != SeasonType.N;
    }

    boolean isMultiplicative() {
        return error == ErrorType.M || season == SeasonType.M;
    }

    int smoothingParameterCount() {
        return 1 + (hasTrend() ? 1 : 0) + (isDamped() ? 1 : 0) + (hasSeason() ? 1 : 0);
    }

    /** Smoothing parameters, initial states and the error variance. */
    int parameterCount(int frequency) {
        int states = 1 + (hasTrend() ? 1 : 0) + (hasSeason() ? frequency - 1 : 0);
        return smoothingParameterCount() + states + 1;
    }

    @Override
    public String toString() {
        return "ETS(" + error + "," + trend.label + "," + season + ")";
    }
}
