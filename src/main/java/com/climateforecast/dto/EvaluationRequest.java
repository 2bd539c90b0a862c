package com.climateforecast.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Dataset plus optional overrides for a holdout or rolling-origin sweep. Unset fields fall back to
 * the {@code evaluation.*} defaults.
 */
@Value
@Builder
@Jacksonized
public class EvaluationRequest {

    @NotEmpty(message = "observations must not be empty")
    List<@Valid ObservationRow> observations;

    List<String> variables;

    List<String> models;

    @Min(value = 1, message = "frequency must be >= 1")
    Integer frequency;

    @DecimalMin(value = "0.0", inclusive = false, message = "trainFraction must be between 0 and 1")
    @DecimalMax(value = "1.0", inclusive = false, message = "trainFraction must be between 0 and 1")
    Double trainFraction;

    Integer initial;
    Integer horizon;
    Integer step;

    List<@Min(value = 1, message = "confidence levels must be between 1 and 99")
         @Max(value = 99, message = "confidence levels must be between 1 and 99") Integer> confidenceLevels;

    @Min(value = 0, message = "fitTimeoutMillis must be >= 0")
    Long fitTimeoutMillis;

    Boolean parallel;
}
