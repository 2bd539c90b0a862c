package com.climateforecast.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * One dated row of the input table. {@code month} is either 1-12 or an English month name
 * (full or three-letter). A {@code null} or absent value marks the observation as missing.
 */
@Value
@Builder
@Jacksonized
public class ObservationRow {

    @NotNull(message = "year is required")
    @Min(value = 1, message = "year must be >= 1")
    @Max(value = 9999, message = "year must be <= 9999")
    Integer year;

    @NotBlank(message = "month is required")
    String month;

    @NotNull(message = "values are required")
    Map<String, Double> values;
}
