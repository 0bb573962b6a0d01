package com.mlops_lifecycle.dto.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelVersionResponse(
        @JsonProperty("model_version") RegistryModelVersion modelVersion
) {}
