package com.climateforecast.service;

import com.climateforecast.dto.ClimatologyResponse;
import com.climateforecast.model.ClimateDataset;
import com.climateforecast.model.ClimateSeries;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Mean of each variable per calendar month, skipping missing observations. */
@Service
public class ClimatologyService {

    public ClimatologyResponse compute(ClimateDataset dataset) {
        List<ClimatologyResponse.VariableClimatology> variables = new ArrayList<>();
        for (ClimateSeries series : dataset.series()) {
            variables.add(ClimatologyResponse.VariableClimatology.builder()
                .variable(series.getVariable())
                .months(monthlyMeans(series))
                .build());
        }
        return ClimatologyResponse.builder().variables(variables).build();
    }

    List<ClimatologyResponse.MonthlyMean> monthlyMeans(ClimateSeries series) {
        SummaryStatistics[] byMonth = new SummaryStatistics[12];
        for (int m = 0; m < 12; m++) {
            byMonth[m] = new SummaryStatistics();
        }
        for (int i = 0; i < series.length(); i++) {
            if (!series.isMissing(i)) {
                byMonth[series.monthAt(i).getMonthValue() - 1].addValue(series.valueAt(i));
            }
        }
        List<ClimatologyResponse.MonthlyMean> months = new ArrayList<>(12);
        for (Month month : Month.values()) {
            SummaryStatistics stats = byMonth[month.getValue() - 1];
            months.add(ClimatologyResponse.MonthlyMean.builder()
                .month(month.getValue())
                .monthName(month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
                .mean(stats.getN() == 0 ? Double.NaN : stats.getMean())
                .observations(stats.getN())
                .build());
        }
        return months;
    }
}
