package com.climateforecast.model;

import com.climateforecast.exception.InvalidSeriesException;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ClimateSeriesTest {

    @Test
    void fromObservations_nullValue_becomesMissingNotZero() {
        ClimateSeries series = ClimateSeries.fromObservations("Precipitation", List.of(
            new ClimateSeries.MonthlyValue(YearMonth.of(1999, 12), 0.0),
            new ClimateSeries.MonthlyValue(YearMonth.of(2000, 1), null)));

        assertThat(series.isMissing(0)).isFalse();
        assertThat(series.valueAt(0)).isZero();
        assertThat(series.isMissing(1)).isTrue();
        assertThat(series.monthAt(1)).isEqualTo(YearMonth.of(2000, 1));
    }

    @Test
    void fromObservations_outOfOrderMonths_areRejected() {
        assertThatThrownBy(() -> ClimateSeries.fromObservations("Temperature", List.of(
                new ClimateSeries.MonthlyValue(YearMonth.of(2000, 2), 1.0),
                new ClimateSeries.MonthlyValue(YearMonth.of(2000, 1), 1.0))))
            .isInstanceOf(InvalidSeriesException.class)
            .hasMessageContaining("not a consecutive monthly sequence");
    }

    @Test
    void of_infiniteValue_isRejected() {
        assertThatThrownBy(() -> ClimateSeries.of("WindSpeed", YearMonth.of(2000, 1), 1.0, Double.POSITIVE_INFINITY))
            .isInstanceOf(InvalidSeriesException.class);
    }

    @Test
    void values_returnsDefensiveCopy() {
        ClimateSeries series = ClimateSeries.of("WindSpeed", YearMonth.of(2000, 1), 1.0, 2.0);

        series.values()[0] = 99.0;

        assertThat(series.valueAt(0)).isEqualTo(1.0);
    }

    @Test
    void split_trainAndTestAreContiguousAndDisjoint() {
        ClimateSeries series = ClimateSeries.of("SoilMoisture", YearMonth.of(2000, 1), 1.0, 2.0, 3.0, 4.0, 5.0);
        TrainTestSplit split = new TrainTestSplit(3, 2);

        assertThat(split.train(series)).containsExactly(1.0, 2.0, 3.0);
        assertThat(split.test(series)).containsExactly(4.0, 5.0);
        assertThatThrownBy(() -> new TrainTestSplit(0, 2)).isInstanceOf(IllegalArgumentException.class);
    }
}
