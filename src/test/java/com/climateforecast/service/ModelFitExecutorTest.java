package com.climateforecast.service;

import com.climateforecast.exception.FitFailureException;
import com.climateforecast.forecasting.FittedModel;
import com.climateforecast.forecasting.ForecastModel;
import com.climateforecast.model.ForecastResult;
import com.climateforecast.model.PredictionInterval;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelFitExecutorTest {

    @Mock ForecastModel model;
    @Mock FittedModel   fitted;

    private ModelFitExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new ModelFitExecutor();
        executor.init();
        lenient().when(model.id()).thenReturn("mock");
        lenient().when(fitted.spec()).thenReturn("MOCK(1)");
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void fitAndForecast_unexpectedRuntimeError_becomesFitFailure() {
        when(model.fit(any(), anyInt())).thenThrow(new ArithmeticException("singular matrix"));

        assertThatThrownBy(() -> executor.fitAndForecast(model, new double[] {1, 2, 3}, 12, 1, List.of(), Duration.ZERO))
            .isInstanceOf(FitFailureException.class)
            .hasMessageContaining("singular matrix")
            .hasCauseInstanceOf(ArithmeticException.class);
    }

    @Test
    void fitAndForecast_wrongForecastLength_isRejected() {
        when(model.fit(any(), anyInt())).thenReturn(fitted);
        when(model.forecast(same(fitted), eq(3), any()))
            .thenReturn(ForecastResult.builder().mean(List.of(1.0, 2.0)).build());

        assertThatThrownBy(() -> executor.fitAndForecast(model, new double[] {1, 2, 3}, 12, 3, List.of(), Duration.ZERO))
            .isInstanceOf(FitFailureException.class)
            .hasMessageContaining("returned 2 forecast points");
    }

    @Test
    void fitAndForecast_nonFiniteForecast_isRejected() {
        when(model.fit(any(), anyInt())).thenReturn(fitted);
        when(model.forecast(same(fitted), eq(1), any()))
            .thenReturn(ForecastResult.builder().mean(List.of(Double.NaN)).build());

        assertThatThrownBy(() -> executor.fitAndForecast(model, new double[] {1, 2, 3}, 12, 1, List.of(), Duration.ZERO))
            .isInstanceOf(FitFailureException.class)
            .hasMessageContaining("non-finite");
    }

    @Test
    void fitAndForecast_collapsedInterval_isRejected() {
        when(model.fit(any(), anyInt())).thenReturn(fitted);
        when(model.forecast(same(fitted), eq(2), any())).thenReturn(ForecastResult.builder()
            .mean(List.of(5.0, 5.0))
            .interval(new PredictionInterval(95, List.of(5.0, 5.0), List.of(5.0, 5.0)))
            .build());

        assertThatThrownBy(() -> executor.fitAndForecast(model, new double[] {1, 2, 3}, 12, 2, List.of(95), Duration.ZERO))
            .isInstanceOf(FitFailureException.class)
            .hasMessageContaining("collapsed 95%");
    }

    @Test
    void fitAndForecast_withinTimeBudget_returnsOutcome() {
        ForecastResult forecast = ForecastResult.builder().mean(List.of(4.0)).build();
        when(model.fit(any(), anyInt())).thenReturn(fitted);
        when(model.forecast(same(fitted), eq(1), any())).thenReturn(forecast);

        ModelFitExecutor.Outcome outcome =
            executor.fitAndForecast(model, new double[] {1, 2, 3}, 12, 1, List.of(), Duration.ofSeconds(5));

        assertThat(outcome.fitted()).isSameAs(fitted);
        assertThat(outcome.forecast()).isSameAs(forecast);
    }
}
