package com.climateforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;
import java.util.List;

/**
 * Observed series with the holdout forecast overlaid on the test months. {@code splitMonth} is the
 * last training month.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastBandResponse {
    String variable;
    String model;
    String modelSpec;
    @JsonFormat(pattern = "yyyy-MM")
    YearMonth splitMonth;
    List<Integer> confidenceLevels;
    List<BandPoint> points;
    String failureReason;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class BandPoint {
        @JsonFormat(pattern = "yyyy-MM")
        YearMonth month;
        Double observed;
        Double forecast;
        List<Bound> bounds;
    }

    @Value
    @Builder
    public static class Bound {
        int level;
        double lower;
        double upper;
    }
}
