package com.climateforecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class HoldoutConfig {
    @Builder.Default
    double trainFraction = 0.8;
    @Builder.Default
    int frequency = ClimateSeries.MONTHLY_FREQUENCY;
    @Builder.Default
    List<Integer> confidenceLevels = List.of(80, 95);
    /** Zero means unbounded. */
    @Builder.Default
    Duration fitTimeout = Duration.ZERO;
}
