package com.mlops_lifecycle.dto.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TransitionStageRequest(
        String name,
        String version,
        String stage,
        @JsonProperty("archive_existing_versions") boolean archiveExistingVersions
) {}
