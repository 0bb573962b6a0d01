package com.mlops_lifecycle.dto.serving;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mlops_lifecycle.enumeration.ModelSourceEnum;
import lombok.Builder;

import java.util.List;

@Builder
public record PredictionResponse(
        int prediction,
        String label,
        List<Double> probability,
        @JsonProperty("model_version") String modelVersion,
        @JsonProperty("model_source") ModelSourceEnum modelSource
) {}
