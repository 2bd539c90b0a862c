package com.climateforecast.forecasting;

import com.climateforecast.exception.FitFailureException;
import com.climateforecast.model.ForecastResult;
import com.climateforecast.model.PredictionInterval;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class ExponentialSmoothingModelTest {

    private final ExponentialSmoothingModel model = new ExponentialSmoothingModel();

    static double[] seasonalTemperature(int n, long seed) {
        Random random = new Random(seed);
        double[] y = new double[n];
        for (int t = 0; t < n; t++) {
            y[t] = 12.0 + 9.0 * Math.sin(2 * Math.PI * t / 12.0) + 0.5 * random.nextGaussian();
        }
        return y;
    }

    @Test
    void fit_seasonalSeries_selectsSeasonalStructureAndForecastsTheCycle() {
        double[] train = seasonalTemperature(48, 7L);

        FittedModel fitted = model.fit(train, 12);
        ForecastResult forecast = fitted.forecast(12, List.of(80, 95));

        assertThat(fitted.spec()).startsWith("ETS(").doesNotEndWith(",N)");
        assertThat(fitted.trainSize()).isEqualTo(48);
        assertThat(Double.isFinite(fitted.informationCriterion())).isTrue();
        assertThat(forecast.getMean()).hasSize(12).allSatisfy(v -> assertThat(v).isBetween(-5.0, 30.0));
        // the forecast for the month at the peak of the cycle stays above the trough month
        assertThat(forecast.getMean().get(3 - 1)).isGreaterThan(forecast.getMean().get(9 - 1));
    }

    @Test
    void forecast_widerLevelGivesWiderInterval() {
        FittedModel fitted = model.fit(seasonalTemperature(48, 11L), 12);

        ForecastResult forecast = fitted.forecast(6, List.of(80, 95));
        PredictionInterval p80 = forecast.interval(80).orElseThrow();
        PredictionInterval p95 = forecast.interval(95).orElseThrow();

        for (int h = 0; h < 6; h++) {
            double mean = forecast.getMean().get(h);
            assertThat(p80.lower().get(h)).isLessThan(mean);
            assertThat(p80.upper().get(h)).isGreaterThan(mean);
            assertThat(p95.lower().get(h)).isLessThan(p80.lower().get(h));
            assertThat(p95.upper().get(h)).isGreaterThan(p80.upper().get(h));
        }
    }

    @Test
    void fit_lessThanTwoSeasons_fallsBackToNonSeasonal() {
        FittedModel fitted = model.fit(seasonalTemperature(20, 3L), 12);

        assertThat(fitted.spec()).endsWith(",N)");
    }

    @Test
    void candidates_nonPositiveData_excludeMultiplicativeForms() {
        double[] train = seasonalTemperature(48, 5L);
        train[10] = -1.0;

        List<EtsSpec> specs = model.candidates(train, 12);

        assertThat(specs).isNotEmpty().noneMatch(EtsSpec::isMultiplicative);
        assertThat(specs).anyMatch(EtsSpec::hasSeason);
    }

    @Test
    void candidates_neverPairAdditiveErrorWithMultiplicativeSeason() {
        double[] train = seasonalTemperature(48, 5L);
        for (int i = 0; i < train.length; i++) {
            train[i] += 20.0;
        }

        assertThat(model.candidates(train, 12))
            .noneMatch(s -> s.error() == EtsSpec.ErrorType.A && s.season() == EtsSpec.SeasonType.M)
            .anyMatch(s -> s.season() == EtsSpec.SeasonType.M);
    }

    @Test
    void fit_constantSeries_isFitFailure() {
        double[] flat = new double[36];
        java.util.Arrays.fill(flat, 4.2);

        assertThatThrownBy(() -> model.fit(flat, 12))
            .isInstanceOf(FitFailureException.class)
            .hasMessageContaining("constant");
    }

    @Test
    void fit_missingValueInTrain_isFitFailure() {
        double[] train = seasonalTemperature(36, 1L);
        train[5] = Double.NaN;

        assertThatThrownBy(() -> model.fit(train, 12))
            .isInstanceOf(FitFailureException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void fit_isDeterministic() {
        double[] train = seasonalTemperature(40, 9L);

        FittedModel first = model.fit(train, 12);
        FittedModel second = model.fit(train, 12);

        assertThat(second.spec()).isEqualTo(first.spec());
        assertThat(second.forecast(3, List.of()).getMean()).isEqualTo(first.forecast(3, List.of()).getMean());
    }
}
