package com.climateforecast.service;

import com.climateforecast.exception.FitFailureException;
import com.climateforecast.exception.InvalidEvaluationConfigException;
import com.climateforecast.forecasting.ForecastModel;
import com.climateforecast.model.ClimateSeries;
import com.climateforecast.model.HoldoutConfig;
import com.climateforecast.model.HoldoutResult;
import com.climateforecast.model.TrainTestSplit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Single chronological split: the first {@code floor(trainFraction * n)} points train the model,
 * the remainder is forecast in one go and scored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HoldoutEvaluator {

    private final ModelFitExecutor fitExecutor;

    public HoldoutResult evaluate(ClimateSeries series, ForecastModel model, HoldoutConfig config) {
        TrainTestSplit split = split(series, model, config);
        double[] train = split.train(series);
        double[] test = split.test(series);

        HoldoutResult.HoldoutResultBuilder result = HoldoutResult.builder()
            .variable(series.getVariable())
            .model(model.id())
            .split(split)
            .test(Arrays.stream(test).boxed().toList());
        try {
            ModelFitExecutor.Outcome outcome = fitExecutor.fitAndForecast(model, train, config.getFrequency(),
                split.horizon(), config.getConfidenceLevels(), config.getFitTimeout());
            AccuracyMetrics.Scores scores = AccuracyMetrics.score(test, outcome.forecast().meanArray());
            log.info("Holdout done | variable={} | model={} | spec={} | train={} | test={} | rmse={}",
                series.getVariable(), model.id(), outcome.fitted().spec(), split.trainEnd(), split.horizon(),
                scores.rmse());
            return result
                .rmse(scores.rmse())
                .mae(scores.mae())
                .mape(scores.mape())
                .forecast(outcome.forecast())
                .fittedModel(outcome.fitted())
                .build();
        } catch (FitFailureException ex) {
            log.warn("Holdout fit failed | variable={} | model={} | reason={}",
                series.getVariable(), model.id(), ex.getMessage());
            return result
                .rmse(Double.NaN)
                .mae(Double.NaN)
                .mape(Double.NaN)
                .failureReason(ex.getMessage())
                .build();
        }
    }

    TrainTestSplit split(ClimateSeries series, ForecastModel model, HoldoutConfig config) {
        int n = series.length();
        double fraction = config.getTrainFraction();
        if (!(fraction > 0.0 && fraction < 1.0)) {
            throw new InvalidEvaluationConfigException(series.getVariable(), model.id(),
                "trainFraction must be strictly between 0 and 1, got " + fraction);
        }
        if (n < 2) {
            throw new InvalidEvaluationConfigException(series.getVariable(), model.id(),
                "holdout needs at least 2 observations, got " + n);
        }
        if (config.getFrequency() < 1) {
            throw new InvalidEvaluationConfigException(series.getVariable(), model.id(),
                "frequency must be >= 1, got " + config.getFrequency());
        }
        int nTrain = (int) Math.floor(fraction * n);
        int horizon = n - nTrain;
        if (nTrain < 1 || horizon < 1) {
            throw new InvalidEvaluationConfigException(series.getVariable(), model.id(),
                "trainFraction " + fraction + " on " + n + " observations leaves " + nTrain
                    + " train and " + horizon + " test points");
        }
        return new TrainTestSplit(nTrain, horizon);
    }
}
