package com.climateforecast.model;

import com.climateforecast.exception.InvalidSeriesException;

import java.time.YearMonth;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Gap-free monthly series for one climatic variable. Read-only once built.
 *
 * <p>Missing observations are stored as {@link #MISSING}; a present zero stays zero.
 */
public final class ClimateSeries {

    public static final double MISSING = Double.NaN;
    public static final int MONTHLY_FREQUENCY = 12;

    private final String variable;
    private final YearMonth start;
    private final int frequency;
    private final double[] values;

    private ClimateSeries(String variable, YearMonth start, int frequency, double[] values) {
        this.variable = variable;
        this.start = start;
        this.frequency = frequency;
        this.values = values;
    }

    public static ClimateSeries of(String variable, YearMonth start, double... values) {
        return of(variable, start, MONTHLY_FREQUENCY, values);
    }

    public static ClimateSeries of(String variable, YearMonth start, int frequency, double... values) {
        if (variable == null || variable.isBlank()) {
            throw new InvalidSeriesException("Series variable name is required");
        }
        Objects.requireNonNull(start, "start");
        if (frequency < 1) {
            throw new InvalidSeriesException("Frequency must be >= 1 for variable " + variable);
        }
        for (double v : values) {
            if (Double.isInfinite(v)) {
                throw new InvalidSeriesException("Series " + variable + " contains an infinite value");
            }
        }
        return new ClimateSeries(variable, start, frequency, values.clone());
    }

    /**
     * Builds a series from dated observations, which must already be in ascending month order
     * with no duplicates and no skipped months.
     */
    public static ClimateSeries fromObservations(String variable, List<MonthlyValue> observations) {
        if (observations.isEmpty()) {
            throw new InvalidSeriesException("Series " + variable + " has no observations");
        }
        double[] values = new double[observations.size()];
        YearMonth previous = null;
        for (int i = 0; i < observations.size(); i++) {
            MonthlyValue obs = observations.get(i);
            if (previous != null && !obs.month().equals(previous.plusMonths(1))) {
                String problem = obs.month().equals(previous) ? "duplicate month " : "gap before ";
                throw new InvalidSeriesException(
                    "Series " + variable + " is not a consecutive monthly sequence: " + problem + obs.month());
            }
            values[i] = obs.value() == null ? MISSING : obs.value();
            previous = obs.month();
        }
        return of(variable, observations.get(0).month(), values);
    }

    public String getVariable() {
        return variable;
    }

    public YearMonth getStart() {
        return start;
    }

    public int getFrequency() {
        return frequency;
    }

    public int length() {
        return values.length;
    }

    public double valueAt(int index) {
        return values[index];
    }

    public boolean isMissing(int index) {
        return Double.isNaN(values[index]);
    }

    public boolean hasMissing(int fromInclusive, int toExclusive) {
        for (int i = fromInclusive; i < toExclusive; i++) {
            if (isMissing(i)) {
                return true;
            }
        }
        return false;
    }

    public YearMonth monthAt(int index) {
        return start.plusMonths(index);
    }

    public double[] values() {
        return values.clone();
    }

    /** Copy of the points in {@code [fromInclusive, toExclusive)}. */
    public double[] slice(int fromInclusive, int toExclusive) {
        return Arrays.copyOfRange(values, fromInclusive, toExclusive);
    }

    @Override
    public String toString() {
        return "ClimateSeries{" + variable + ", start=" + start + ", length=" + values.length + "}";
    }

    public record MonthlyValue(YearMonth month, Double value) {}
}
