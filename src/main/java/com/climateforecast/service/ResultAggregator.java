package com.climateforecast.service;

import com.climateforecast.forecasting.ForecastModel;
import com.climateforecast.model.FoldMetric;
import com.climateforecast.model.HoldoutReport;
import com.climateforecast.model.HoldoutResult;
import com.climateforecast.model.HoldoutRow;
import com.climateforecast.model.SummaryRow;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Turns per-run results into the two reporting tables. Output rows follow the variable order
 * first and the model order second; NaN metrics never enter a mean or standard deviation.
 */
@Component
public class ResultAggregator {

    public HoldoutReport holdoutReport(List<HoldoutResult> results, List<ForecastModel> models,
                                       List<String> variables, double trainFraction) {
        List<HoldoutReport.ModelTable> tables = new ArrayList<>();
        for (ForecastModel model : models) {
            List<HoldoutRow> rows = new ArrayList<>();
            for (String variable : variables) {
                results.stream()
                    .filter(r -> r.getModel().equals(model.id()) && r.getVariable().equals(variable))
                    .findFirst()
                    .map(this::toRow)
                    .ifPresent(rows::add);
            }
            tables.add(HoldoutReport.ModelTable.builder()
                .model(model.id())
                .displayName(model.displayName())
                .rows(rows)
                .build());
        }
        return HoldoutReport.builder()
            .trainFraction(trainFraction)
            .tables(tables)
            .build();
    }

    /** Groups in order of first appearance of each variable and each model. */
    public List<SummaryRow> summarize(List<FoldMetric> folds) {
        Set<String> variables = new LinkedHashSet<>();
        Set<String> models = new LinkedHashSet<>();
        for (FoldMetric fold : folds) {
            variables.add(fold.getVariable());
            models.add(fold.getModel());
        }
        return summarize(folds, List.copyOf(variables), List.copyOf(models));
    }

    /**
     * One row per (variable, model) pair in the given order. A pair without folds still gets a row,
     * with a fold count of zero and NaN statistics.
     */
    public List<SummaryRow> summarize(List<FoldMetric> folds, List<String> variables, List<String> models) {
        Map<String, List<FoldMetric>> groups = new LinkedHashMap<>();
        for (FoldMetric fold : folds) {
            groups.computeIfAbsent(key(fold.getVariable(), fold.getModel()), k -> new ArrayList<>()).add(fold);
        }
        List<SummaryRow> rows = new ArrayList<>();
        for (String variable : variables) {
            for (String model : models) {
                rows.add(summaryRow(variable, model, groups.getOrDefault(key(variable, model), List.of())));
            }
        }
        return rows;
    }

    SummaryRow summaryRow(String variable, String model, List<FoldMetric> group) {
        DescriptiveStatistics rmse = stats(group, FoldMetric::getRmse);
        DescriptiveStatistics mae = stats(group, FoldMetric::getMae);
        DescriptiveStatistics mape = stats(group, FoldMetric::getMape);
        int failed = (int) group.stream().filter(FoldMetric::isFailed).count();
        return SummaryRow.builder()
            .variable(variable)
            .model(model)
            .meanRmse(rmse.getMean())
            .sdRmse(sampleSd(rmse))
            .meanMae(mae.getMean())
            .sdMae(sampleSd(mae))
            .meanMape(mape.getMean())
            .sdMape(sampleSd(mape))
            .folds((int) rmse.getN())
            .totalFolds(group.size())
            .failedFolds(failed)
            .build();
    }

    private HoldoutRow toRow(HoldoutResult result) {
        return HoldoutRow.builder()
            .variable(result.getVariable())
            .rmse(result.getRmse())
            .mae(result.getMae())
            .mape(result.getMape())
            .trainSize(result.getSplit().trainEnd())
            .testSize(result.getSplit().horizon())
            .modelSpec(result.getFittedModel() != null ? result.getFittedModel().spec() : null)
            .failureReason(result.getFailureReason())
            .build();
    }

    private static DescriptiveStatistics stats(List<FoldMetric> group, ToDoubleFunction<FoldMetric> metric) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        group.stream()
            .mapToDouble(metric)
            .filter(v -> !Double.isNaN(v))
            .forEach(stats::addValue);
        return stats;
    }

    // DescriptiveStatistics reports 0 for a single value; a one-fold group has no spread estimate.
    private static double sampleSd(DescriptiveStatistics stats) {
        return stats.getN() < 2 ? Double.NaN : stats.getStandardDeviation();
    }

    private static String key(String variable, String model) {
        return variable + "||" + model;
    }
}
