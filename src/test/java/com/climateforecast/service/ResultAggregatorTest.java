package com.climateforecast.service;

import com.climateforecast.model.FoldMetric;
import com.climateforecast.model.HoldoutReport;
import com.climateforecast.model.HoldoutResult;
import com.climateforecast.model.SummaryRow;
import com.climateforecast.model.TrainTestSplit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    private static FoldMetric fold(String variable, String model, int origin, double rmse) {
        return FoldMetric.builder()
            .variable(variable).model(model).origin(origin)
            .rmse(rmse).mae(Double.isNaN(rmse) ? Double.NaN : rmse / 2).mape(Double.NaN)
            .actual(List.of(1.0)).predicted(List.of(1.0))
            .build();
    }

    private static FoldMetric failed(String variable, String model, int origin) {
        return FoldMetric.builder()
            .variable(variable).model(model).origin(origin)
            .rmse(Double.NaN).mae(Double.NaN).mape(Double.NaN)
            .actual(List.of(1.0)).failureReason("no candidate converged")
            .build();
    }

    @Test
    void summarize_excludesNaNFromMeanAndSd() {
        List<FoldMetric> folds = List.of(
            fold("Temperature", "hw", 36, 1.0),
            fold("Temperature", "hw", 37, 2.0),
            failed("Temperature", "hw", 38),
            fold("Temperature", "hw", 39, 3.0));

        SummaryRow row = aggregator.summarize(folds).get(0);

        assertThat(row.getMeanRmse()).isCloseTo(2.0, within(1e-12));
        assertThat(row.getSdRmse()).isCloseTo(1.0, within(1e-12));
        assertThat(row.getMeanMae()).isCloseTo(1.0, within(1e-12));
        assertThat(row.getFolds()).isEqualTo(3);
        assertThat(row.getTotalFolds()).isEqualTo(4);
        assertThat(row.getFailedFolds()).isEqualTo(1);
        assertThat(row.getMeanMape()).isNaN();
        assertThat(row.getSdMape()).isNaN();
    }

    @Test
    void summarize_singleContributingFold_hasUndefinedSd() {
        SummaryRow row = aggregator.summarize(List.of(fold("WindSpeed", "sarima", 36, 4.0))).get(0);

        assertThat(row.getMeanRmse()).isEqualTo(4.0);
        assertThat(row.getSdRmse()).isNaN();
        assertThat(row.getFolds()).isEqualTo(1);
    }

    @Test
    void summarize_ordersByVariableThenModel() {
        List<FoldMetric> folds = List.of(
            fold("Precipitation", "hw", 36, 1.0),
            fold("Temperature", "sarima", 36, 1.0),
            fold("Temperature", "hw", 36, 1.0),
            fold("Precipitation", "sarima", 36, 1.0));

        List<SummaryRow> rows = aggregator.summarize(folds,
            List.of("Temperature", "Precipitation"), List.of("sarima", "hw"));

        assertThat(rows).extracting(r -> r.getVariable() + "/" + r.getModel())
            .containsExactly("Temperature/sarima", "Temperature/hw", "Precipitation/sarima", "Precipitation/hw");
    }

    @Test
    void summarize_pairWithoutFolds_reportsZeroCountAndNaN() {
        List<SummaryRow> rows = aggregator.summarize(List.of(fold("Temperature", "hw", 36, 1.0)),
            List.of("Temperature", "SoilMoisture"), List.of("hw"));

        SummaryRow empty = rows.get(1);
        assertThat(empty.getVariable()).isEqualTo("SoilMoisture");
        assertThat(empty.getFolds()).isZero();
        assertThat(empty.getTotalFolds()).isZero();
        assertThat(empty.getMeanRmse()).isNaN();
    }

    @Test
    void holdoutReport_buildsOneTablePerModelInVariableOrder() {
        NaiveStubModel sarima = new NaiveStubModel("sarima");
        NaiveStubModel hw = new NaiveStubModel("hw");
        List<HoldoutResult> results = List.of(
            holdout("Temperature", "hw", 1.5, null),
            holdout("Precipitation", "sarima", 2.5, null),
            holdout("Temperature", "sarima", 0.5, null),
            holdout("Precipitation", "hw", Double.NaN, "train segment is constant"));

        HoldoutReport report = aggregator.holdoutReport(results, List.of(sarima, hw),
            List.of("Temperature", "Precipitation"), 0.8);

        assertThat(report.getTrainFraction()).isEqualTo(0.8);
        assertThat(report.getTables()).extracting(HoldoutReport.ModelTable::getModel).containsExactly("sarima", "hw");
        HoldoutReport.ModelTable first = report.getTables().get(0);
        assertThat(first.getDisplayName()).isEqualTo("Naive sarima");
        assertThat(first.getRows()).extracting(r -> r.getVariable()).containsExactly("Temperature", "Precipitation");
        assertThat(first.getRows().get(0).getRmse()).isEqualTo(0.5);
        assertThat(first.getRows().get(0).getTrainSize()).isEqualTo(38);
        assertThat(report.getTables().get(1).getRows().get(1).getFailureReason()).contains("constant");
    }

    private static HoldoutResult holdout(String variable, String model, double rmse, String failure) {
        return HoldoutResult.builder()
            .variable(variable).model(model)
            .split(new TrainTestSplit(38, 10))
            .rmse(rmse).mae(rmse).mape(rmse)
            .failureReason(failure)
            .build();
    }
}
