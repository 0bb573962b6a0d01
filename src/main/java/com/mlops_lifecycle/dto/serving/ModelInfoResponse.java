package com.mlops_lifecycle.dto.serving;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mlops_lifecycle.enumeration.ModelSourceEnum;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder
public record ModelInfoResponse(
        String name,
        String version,
        ModelSourceEnum source,
        String algorithm,
        @JsonProperty("num_features") int numFeatures,
        @JsonProperty("feature_names") List<String> featureNames,
        @JsonProperty("class_labels") List<String> classLabels,
        @JsonProperty("loaded_at") Instant loadedAt
) {}
