package com.climateforecast.service;

import com.climateforecast.dto.ForecastBandResponse;
import com.climateforecast.model.ClimateSeries;
import com.climateforecast.model.HoldoutConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.Set;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class ForecastBandServiceTest {

    private ModelFitExecutor fitExecutor;
    private ForecastBandService service;

    @BeforeEach
    void setUp() {
        fitExecutor = new ModelFitExecutor();
        fitExecutor.init();
        service = new ForecastBandService(new HoldoutEvaluator(fitExecutor));
    }

    @AfterEach
    void tearDown() {
        fitExecutor.shutdown();
    }

    private static ClimateSeries series() {
        double[] values = IntStream.rangeClosed(1, 10).asDoubleStream().toArray();
        return ClimateSeries.of("SoilMoisture", YearMonth.of(2015, 1), values);
    }

    @Test
    void band_overlaysForecastAndBoundsOnTestMonthsOnly() {
        ForecastBandResponse band = service.band(series(), new NaiveStubModel("naive"), HoldoutConfig.builder().build());

        assertThat(band.getSplitMonth()).isEqualTo(YearMonth.of(2015, 8));
        assertThat(band.getModelSpec()).isEqualTo("NAIVE");
        assertThat(band.getPoints()).hasSize(10);
        assertThat(band.getPoints().get(7).getForecast()).isNull();
        assertThat(band.getPoints().get(7).getObserved()).isEqualTo(8.0);

        ForecastBandResponse.BandPoint first = band.getPoints().get(8);
        assertThat(first.getMonth()).isEqualTo(YearMonth.of(2015, 9));
        assertThat(first.getForecast()).isEqualTo(8.0);
        assertThat(first.getBounds()).extracting(ForecastBandResponse.Bound::getLevel).containsExactly(80, 95);
        ForecastBandResponse.Bound wide = first.getBounds().get(1);
        assertThat(wide.getLower()).isLessThan(first.getBounds().get(0).getLower());
        assertThat(wide.getUpper()).isGreaterThan(first.getBounds().get(0).getUpper());
    }

    @Test
    void band_failedFit_keepsObservedValuesAndReportsReason() {
        ForecastBandResponse band = service.band(series(), new NaiveStubModel("broken", Set.of(8), 0),
            HoldoutConfig.builder().build());

        assertThat(band.getFailureReason()).contains("refused");
        assertThat(band.getPoints()).allSatisfy(p -> assertThat(p.getForecast()).isNull());
        assertThat(band.getPoints().get(9).getObserved()).isEqualTo(10.0);
    }
}
