package com.mlops_lifecycle.service;

import com.mlops_lifecycle.dto.registry.RegistryArtifact;
import com.mlops_lifecycle.dto.registry.RegistryModelVersion;
import com.mlops_lifecycle.enumeration.ModelStageEnum;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client of the remote model registry. Implementations never retry and report every failure
 * as {@link com.mlops_lifecycle.exception.RegistryUnavailableException}; what to do about it is
 * the caller's decision.
 */
public interface RegistrySync {

    /**
     * All versions registered under {@code modelName}, in the order the registry returns them.
     * That order carries no meaning.
     */
    List<RegistryModelVersion> listVersions(String modelName);

    /**
     * Moves one version to {@code stage}. With {@code archiveExisting} the registry archives the
     * previous holders of that stage in the same call.
     */
    RegistryModelVersion transitionStage(String modelName, String version, ModelStageEnum stage, boolean archiveExisting);

    Optional<RegistryModelVersion> findProductionVersion(String modelName);

    /**
     * Fetches the model artifact of {@code version} into a temp file owned by the caller.
     */
    Path downloadArtifact(RegistryModelVersion version);

    /**
     * Attaches metrics to an existing registry run.
     */
    void logMetrics(String runId, Map<String, Double> metrics);

    default Optional<RegistryArtifact> fetchProduction(String modelName) {
        return findProductionVersion(modelName)
                .map(version -> new RegistryArtifact(version, downloadArtifact(version)));
    }
}
