package com.climateforecast.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ClimatologyRequest {

    @NotEmpty(message = "observations must not be empty")
    List<@Valid ObservationRow> observations;

    List<String> variables;
}
