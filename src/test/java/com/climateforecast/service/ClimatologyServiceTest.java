package com.climateforecast.service;

import com.climateforecast.dto.ClimatologyResponse;
import com.climateforecast.model.ClimateDataset;
import com.climateforecast.model.ClimateSeries;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ClimatologyServiceTest {

    private final ClimatologyService service = new ClimatologyService();

    @Test
    void compute_averagesEachCalendarMonthSkippingMissing() {
        double[] values = new double[24];
        for (int i = 0; i < 24; i++) {
            values[i] = (i % 12) + 1 + (i >= 12 ? 2 : 0);
        }
        values[13] = ClimateSeries.MISSING;
        ClimateSeries series = ClimateSeries.of("Temperature", YearMonth.of(2010, 1), values);

        ClimatologyResponse response = service.compute(ClimateDataset.of(List.of(series)));

        List<ClimatologyResponse.MonthlyMean> months = response.getVariables().get(0).getMonths();
        assertThat(months).hasSize(12);
        assertThat(months.get(0).getMean()).isEqualTo(2.0);
        assertThat(months.get(0).getMonthName()).isEqualTo("Jan");
        assertThat(months.get(1).getMean()).isEqualTo(2.0);
        assertThat(months.get(1).getObservations()).isEqualTo(1);
        assertThat(months.get(11).getMean()).isEqualTo(13.0);
    }

    @Test
    void compute_seriesStartingMidYear_stillReportsCalendarOrder() {
        ClimateSeries series = ClimateSeries.of("WindSpeed", YearMonth.of(2010, 11), 4.0, 6.0);

        List<ClimatologyResponse.MonthlyMean> months =
            service.compute(ClimateDataset.of(List.of(series))).getVariables().get(0).getMonths();

        assertThat(months.get(10).getMean()).isEqualTo(4.0);
        assertThat(months.get(11).getMean()).isEqualTo(6.0);
        assertThat(months.get(0).getMean()).isNaN();
        assertThat(months.get(0).getObservations()).isZero();
    }
}
