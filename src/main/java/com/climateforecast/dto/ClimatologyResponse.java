package com.climateforecast.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ClimatologyResponse {
    List<VariableClimatology> variables;

    @Value
    @Builder
    public static class VariableClimatology {
        String variable;
        List<MonthlyMean> months;
    }

    @Value
    @Builder
    public static class MonthlyMean {
        int month;
        String monthName;
        double mean;
        long observations;
    }
}
