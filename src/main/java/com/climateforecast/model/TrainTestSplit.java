package com.climateforecast.model;

/**
 * Chronological split: train is {@code [0, trainEnd)}, test is {@code [trainEnd, trainEnd + horizon)}.
 */
public record TrainTestSplit(int trainEnd, int horizon) {

    public TrainTestSplit {
        if (trainEnd < 1 || horizon < 1) {
            throw new IllegalArgumentException(
                "split needs at least one train and one test point, got trainEnd=" + trainEnd + ", horizon=" + horizon);
        }
    }

    public int testStart() {
        return trainEnd;
    }

    public int testEnd() {
        return trainEnd + horizon;
    }

    public double[] train(ClimateSeries series) {
        return series.slice(0, trainEnd);
    }

    public double[] test(ClimateSeries series) {
        return series.slice(trainEnd, testEnd());
    }
}
