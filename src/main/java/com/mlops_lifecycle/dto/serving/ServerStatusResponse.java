package com.mlops_lifecycle.dto.serving;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mlops_lifecycle.enumeration.ModelSourceEnum;

/**
 * Body of {@code GET /} and {@code GET /health}. {@code message} is only set on the root endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerStatusResponse(
        String message,
        String status,
        @JsonProperty("model_loaded") boolean modelLoaded,
        ModelSourceEnum source,
        String version
) {}
