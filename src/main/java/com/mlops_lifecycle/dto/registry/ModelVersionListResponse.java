package com.mlops_lifecycle.dto.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body shared by the version search and latest-versions endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelVersionListResponse(
        @JsonProperty("model_versions") List<RegistryModelVersion> modelVersions
) {
    public ModelVersionListResponse {
        modelVersions = modelVersions == null ? List.of() : List.copyOf(modelVersions);
    }
}
