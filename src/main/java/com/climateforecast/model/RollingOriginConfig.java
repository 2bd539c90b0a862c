package com.climateforecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class RollingOriginConfig {
    @Builder.Default
    int frequency = ClimateSeries.MONTHLY_FREQUENCY;
    @Builder.Default
    int initial = 36;
    @Builder.Default
    int horizon = 1;
    @Builder.Default
    int step = 1;
    @Builder.Default
    List<Integer> confidenceLevels = List.of();
    @Builder.Default
    Duration fitTimeout = Duration.ZERO;
    @Builder.Default
    boolean parallel = false;
}
