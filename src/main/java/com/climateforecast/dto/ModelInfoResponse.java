package com.climateforecast.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ModelInfoResponse {
    String id;
    String displayName;
}
