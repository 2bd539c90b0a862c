package com.climateforecast.service;

import com.climateforecast.exception.FitFailureException;
import com.climateforecast.exception.InvalidEvaluationConfigException;
import com.climateforecast.forecasting.ForecastModel;
import com.climateforecast.model.ClimateSeries;
import com.climateforecast.model.FoldMetric;
import com.climateforecast.model.RollingOriginConfig;
import com.climateforecast.model.TrainTestSplit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

/**
 * Walk-forward validation with an expanding window. Origin {@code k} trains on the first
 * {@code k} points and scores the next {@code horizon}; origins advance by {@code step}
 * while {@code origin + horizon <= length}. Rows come back in ascending origin order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RollingOriginEvaluator {

    private final ModelFitExecutor fitExecutor;

    public List<FoldMetric> evaluate(ClimateSeries series, ForecastModel model, RollingOriginConfig config) {
        List<Integer> origins = origins(series, model, config);
        if (origins.isEmpty()) {
            log.warn("Rolling origin produced no folds | variable={} | model={} | length={} | initial={} | horizon={}",
                series.getVariable(), model.id(), series.length(), config.getInitial(), config.getHorizon());
            return List.of();
        }

        Stream<Integer> stream = config.isParallel() ? origins.parallelStream() : origins.stream();
        List<FoldMetric> folds = stream
            .map(origin -> evaluateFold(series, model, config, origin))
            .toList();

        long failed = folds.stream().filter(FoldMetric::isFailed).count();
        log.info("Rolling origin done | variable={} | model={} | folds={} | failed={}",
            series.getVariable(), model.id(), folds.size(), failed);
        return folds;
    }

    List<Integer> origins(ClimateSeries series, ForecastModel model, RollingOriginConfig config) {
        int n = series.length();
        int initial = config.getInitial();
        int horizon = config.getHorizon();
        int step = config.getStep();
        if (initial < 1) {
            throw new InvalidEvaluationConfigException(series.getVariable(), model.id(),
                "initial window must be >= 1, got " + initial);
        }
        if (initial >= n) {
            throw new InvalidEvaluationConfigException(series.getVariable(), model.id(),
                "initial window " + initial + " leaves no data to forecast in a series of length " + n);
        }
        if (horizon < 1) {
            throw new InvalidEvaluationConfigException(series.getVariable(), model.id(),
                "horizon must be >= 1, got " + horizon);
        }
        if (step < 1) {
            throw new InvalidEvaluationConfigException(series.getVariable(), model.id(),
                "step must be >= 1, got " + step);
        }
        if (config.getFrequency() < 1) {
            throw new InvalidEvaluationConfigException(series.getVariable(), model.id(),
                "frequency must be >= 1, got " + config.getFrequency());
        }
        // long arithmetic: horizon and step are unbounded request values
        List<Integer> origins = new ArrayList<>();
        for (long origin = initial; origin + horizon <= n; origin += step) {
            origins.add((int) origin);
        }
        return origins;
    }

    private FoldMetric evaluateFold(ClimateSeries series, ForecastModel model, RollingOriginConfig config, int origin) {
        TrainTestSplit split = new TrainTestSplit(origin, config.getHorizon());
        double[] train = split.train(series);
        double[] test = split.test(series);
        FoldMetric.FoldMetricBuilder fold = FoldMetric.builder()
            .variable(series.getVariable())
            .model(model.id())
            .origin(origin)
            .actual(Arrays.stream(test).boxed().toList());
        try {
            ModelFitExecutor.Outcome outcome = fitExecutor.fitAndForecast(model, train, config.getFrequency(),
                split.horizon(), config.getConfidenceLevels(), config.getFitTimeout());
            double[] predicted = outcome.forecast().meanArray();
            AccuracyMetrics.Scores scores = AccuracyMetrics.score(test, predicted);
            return fold
                .rmse(scores.rmse())
                .mae(scores.mae())
                .mape(scores.mape())
                .predicted(Arrays.stream(predicted).boxed().toList())
                .modelSpec(outcome.fitted().spec())
                .build();
        } catch (FitFailureException ex) {
            log.warn("Fold fit failed | variable={} | model={} | origin={} | reason={}",
                series.getVariable(), model.id(), origin, ex.getMessage());
            return fold
                .rmse(Double.NaN)
                .mae(Double.NaN)
                .mape(Double.NaN)
                .failureReason(ex.getMessage())
                .build();
        }
    }
}
