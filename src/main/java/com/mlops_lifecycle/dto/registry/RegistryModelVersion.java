package com.mlops_lifecycle.dto.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mlops_lifecycle.enumeration.ModelStageEnum;

/**
 * A version as the registry reports it. Owned by the registry; only observed here.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryModelVersion(
        String name,
        String version,
        @JsonProperty("current_stage") ModelStageEnum stage,
        @JsonProperty("run_id") String runId,
        String source,
        @JsonProperty("creation_timestamp") Long creationTimestamp
) {
    public RegistryModelVersion {
        stage = stage == null ? ModelStageEnum.NONE : stage;
    }

    /**
     * Registry versions are monotonically increasing integers serialized as strings.
     */
    public long numericVersion() {
        try {
            return Long.parseLong(version);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Registry version is not numeric: " + version, e);
        }
    }
}
