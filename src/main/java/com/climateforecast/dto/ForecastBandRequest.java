package com.climateforecast.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ForecastBandRequest {

    @NotEmpty(message = "observations must not be empty")
    List<@Valid ObservationRow> observations;

    @NotBlank(message = "variable is required")
    String variable;

    @NotBlank(message = "model is required")
    String model;

    @DecimalMin(value = "0.0", inclusive = false, message = "trainFraction must be between 0 and 1")
    @DecimalMax(value = "1.0", inclusive = false, message = "trainFraction must be between 0 and 1")
    Double trainFraction;

    @Min(value = 1, message = "frequency must be >= 1")
    Integer frequency;

    List<@Min(value = 1, message = "confidence levels must be between 1 and 99")
         @Max(value = 99, message = "confidence levels must be between 1 and 99") Integer> confidenceLevels;
}
