package com.climateforecast.service;

import com.climateforecast.dto.ForecastBandResponse;
import com.climateforecast.forecasting.ForecastModel;
import com.climateforecast.model.ClimateSeries;
import com.climateforecast.model.ForecastResult;
import com.climateforecast.model.HoldoutConfig;
import com.climateforecast.model.HoldoutResult;
import com.climateforecast.model.PredictionInterval;
import com.climateforecast.model.TrainTestSplit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Observed-versus-forecast data for one variable and one model family: every month of the series
 * with its observed value, and on the test months the holdout forecast and its bounds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastBandService {

    private final HoldoutEvaluator holdoutEvaluator;

    public ForecastBandResponse band(ClimateSeries series, ForecastModel model, HoldoutConfig config) {
        HoldoutResult result = holdoutEvaluator.evaluate(series, model, config);
        TrainTestSplit split = result.getSplit();
        ForecastResult forecast = result.getForecast();

        List<ForecastBandResponse.BandPoint> points = new ArrayList<>(series.length());
        for (int i = 0; i < series.length(); i++) {
            ForecastBandResponse.BandPoint.BandPointBuilder point = ForecastBandResponse.BandPoint.builder()
                .month(series.monthAt(i))
                .observed(series.isMissing(i) ? null : series.valueAt(i));
            if (forecast != null && i >= split.testStart()) {
                int h = i - split.testStart();
                point.forecast(forecast.getMean().get(h)).bounds(bounds(forecast, h));
            }
            points.add(point.build());
        }

        log.info("Forecast band built | variable={} | model={} | split={} | failed={}",
            series.getVariable(), model.id(), series.monthAt(split.trainEnd() - 1), result.isFailed());
        return ForecastBandResponse.builder()
            .variable(series.getVariable())
            .model(model.id())
            .modelSpec(result.getFittedModel() != null ? result.getFittedModel().spec() : null)
            .splitMonth(series.monthAt(split.trainEnd() - 1))
            .confidenceLevels(config.getConfidenceLevels())
            .points(points)
            .failureReason(result.getFailureReason())
            .build();
    }

    private static List<ForecastBandResponse.Bound> bounds(ForecastResult forecast, int h) {
        List<ForecastBandResponse.Bound> bounds = new ArrayList<>(forecast.getIntervals().size());
        for (PredictionInterval interval : forecast.getIntervals()) {
            bounds.add(ForecastBandResponse.Bound.builder()
                .level(interval.level())
                .lower(interval.lower().get(h))
                .upper(interval.upper().get(h))
                .build());
        }
        return bounds;
    }
}
