package com.climateforecast.service;

import com.climateforecast.dto.ClimatologyRequest;
import com.climateforecast.dto.ClimatologyResponse;
import com.climateforecast.dto.EvaluationRequest;
import com.climateforecast.dto.ForecastBandRequest;
import com.climateforecast.dto.ForecastBandResponse;
import com.climateforecast.dto.ModelInfoResponse;
import com.climateforecast.forecasting.ForecastModel;
import com.climateforecast.forecasting.ForecastModelRegistry;
import com.climateforecast.model.ClimateDataset;
import com.climateforecast.model.ClimateSeries;
import com.climateforecast.model.FoldMetric;
import com.climateforecast.model.HoldoutConfig;
import com.climateforecast.model.HoldoutReport;
import com.climateforecast.model.HoldoutResult;
import com.climateforecast.model.RollingOriginConfig;
import com.climateforecast.model.RollingOriginReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Runs the evaluators over every (variable, model) pair of a dataset. Variables are visited in
 * dataset order and models in the requested order, which is also the order of the report rows.
 * Configuration errors for any pair are raised before the first model is fitted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    private final ClimateDatasetAssembler datasetAssembler;
    private final ForecastModelRegistry modelRegistry;
    private final HoldoutEvaluator holdoutEvaluator;
    private final RollingOriginEvaluator rollingOriginEvaluator;
    private final ResultAggregator resultAggregator;
    private final ForecastBandService forecastBandService;
    private final ClimatologyService climatologyService;

    @Value("${evaluation.frequency:12}")
    private int defaultFrequency = ClimateSeries.MONTHLY_FREQUENCY;

    @Value("${evaluation.train-fraction:0.8}")
    private double defaultTrainFraction = 0.8;

    @Value("${evaluation.initial:36}")
    private int defaultInitial = 36;

    @Value("${evaluation.horizon:1}")
    private int defaultHorizon = 1;

    @Value("${evaluation.step:1}")
    private int defaultStep = 1;

    @Value("${evaluation.confidence-levels:80,95}")
    private List<Integer> defaultConfidenceLevels = List.of(80, 95);

    @Value("${evaluation.fit-timeout:0s}")
    private Duration defaultFitTimeout = Duration.ZERO;

    @Value("${evaluation.parallel:false}")
    private boolean defaultParallel = false;

    public HoldoutReport holdout(EvaluationRequest request) {
        ClimateDataset dataset = datasetAssembler.assemble(request.getObservations(), request.getVariables());
        List<ForecastModel> models = modelRegistry.resolve(request.getModels());
        return runHoldout(dataset, models, holdoutConfig(request));
    }

    public RollingOriginReport rollingOrigin(EvaluationRequest request) {
        return rollingOrigin(request, progress -> { });
    }

    /** {@code progress} receives a completion percentage after each (variable, model) pair. */
    public RollingOriginReport rollingOrigin(EvaluationRequest request, IntConsumer progress) {
        ClimateDataset dataset = datasetAssembler.assemble(request.getObservations(), request.getVariables());
        List<ForecastModel> models = modelRegistry.resolve(request.getModels());
        return runRollingOrigin(dataset, models, rollingOriginConfig(request), progress);
    }

    public ForecastBandResponse forecastBand(ForecastBandRequest request) {
        ClimateDataset dataset = datasetAssembler.assemble(request.getObservations(), List.of(request.getVariable()));
        ForecastModel model = modelRegistry.get(request.getModel());
        HoldoutConfig config = HoldoutConfig.builder()
            .trainFraction(valueOr(request.getTrainFraction(), defaultTrainFraction))
            .frequency(valueOr(request.getFrequency(), defaultFrequency))
            .confidenceLevels(levelsOr(request.getConfidenceLevels()))
            .fitTimeout(defaultFitTimeout)
            .build();
        return forecastBandService.band(dataset.get(request.getVariable()), model, config);
    }

    public ClimatologyResponse climatology(ClimatologyRequest request) {
        return climatologyService.compute(datasetAssembler.assemble(request.getObservations(), request.getVariables()));
    }

    public List<ModelInfoResponse> models() {
        return modelRegistry.all().stream()
            .map(m -> ModelInfoResponse.builder().id(m.id()).displayName(m.displayName()).build())
            .toList();
    }

    public HoldoutReport runHoldout(ClimateDataset dataset, List<ForecastModel> models, HoldoutConfig config) {
        for (ClimateSeries series : dataset.series()) {
            for (ForecastModel model : models) {
                holdoutEvaluator.split(series, model, config);
            }
        }
        log.info("Holdout sweep started | variables={} | models={} | trainFraction={}",
            dataset.variables(), ids(models), config.getTrainFraction());

        List<HoldoutResult> results = new ArrayList<>();
        for (ClimateSeries series : dataset.series()) {
            for (ForecastModel model : models) {
                results.add(holdoutEvaluator.evaluate(series, model, config));
            }
        }
        long failed = results.stream().filter(HoldoutResult::isFailed).count();
        log.info("Holdout sweep done | runs={} | failed={}", results.size(), failed);
        return resultAggregator.holdoutReport(results, models, dataset.variables(), config.getTrainFraction());
    }

    public RollingOriginReport runRollingOrigin(ClimateDataset dataset, List<ForecastModel> models,
                                                RollingOriginConfig config, IntConsumer progress) {
        for (ClimateSeries series : dataset.series()) {
            for (ForecastModel model : models) {
                rollingOriginEvaluator.origins(series, model, config);
            }
        }
        log.info("Rolling-origin sweep started | variables={} | models={} | initial={} | horizon={} | step={}",
            dataset.variables(), ids(models), config.getInitial(), config.getHorizon(), config.getStep());

        int pairs = dataset.series().size() * models.size();
        int done = 0;
        List<FoldMetric> folds = new ArrayList<>();
        for (ClimateSeries series : dataset.series()) {
            for (ForecastModel model : models) {
                folds.addAll(rollingOriginEvaluator.evaluate(series, model, config));
                done++;
                progress.accept(pairs == 0 ? 100 : done * 100 / pairs);
            }
        }

        log.info("Rolling-origin sweep done | folds={} | failed={}",
            folds.size(), folds.stream().filter(FoldMetric::isFailed).count());
        return RollingOriginReport.builder()
            .initial(config.getInitial())
            .horizon(config.getHorizon())
            .step(config.getStep())
            .folds(folds)
            .summary(resultAggregator.summarize(folds, dataset.variables(), ids(models)))
            .build();
    }

    HoldoutConfig holdoutConfig(EvaluationRequest request) {
        return HoldoutConfig.builder()
            .trainFraction(valueOr(request.getTrainFraction(), defaultTrainFraction))
            .frequency(valueOr(request.getFrequency(), defaultFrequency))
            .confidenceLevels(levelsOr(request.getConfidenceLevels()))
            .fitTimeout(timeoutOr(request.getFitTimeoutMillis()))
            .build();
    }

    RollingOriginConfig rollingOriginConfig(EvaluationRequest request) {
        return RollingOriginConfig.builder()
            .frequency(valueOr(request.getFrequency(), defaultFrequency))
            .initial(valueOr(request.getInitial(), defaultInitial))
            .horizon(valueOr(request.getHorizon(), defaultHorizon))
            .step(valueOr(request.getStep(), defaultStep))
            .confidenceLevels(request.getConfidenceLevels() == null ? List.of() : request.getConfidenceLevels())
            .fitTimeout(timeoutOr(request.getFitTimeoutMillis()))
            .parallel(valueOr(request.getParallel(), defaultParallel))
            .build();
    }

    private List<Integer> levelsOr(List<Integer> levels) {
        return levels == null ? defaultConfidenceLevels : levels;
    }

    private Duration timeoutOr(Long millis) {
        return millis == null ? defaultFitTimeout : Duration.ofMillis(millis);
    }

    private static <T> T valueOr(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static List<String> ids(List<ForecastModel> models) {
        return models.stream().map(ForecastModel::id).toList();
    }
}
