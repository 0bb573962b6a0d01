package com.mlops_lifecycle.service;

import com.mlops_lifecycle.config.PipelineParamsResolver;
import com.mlops_lifecycle.dto.registry.RegistryModelVersion;
import com.mlops_lifecycle.enumeration.ModelStageEnum;
import com.mlops_lifecycle.enumeration.VersionSelectionPolicyEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Picks the registry version that corresponds to the locally promoted artifact.
 * <ol>
 *     <li>When the training run is known, the version registered from that run.</li>
 *     <li>Otherwise the configured policy decides. Archived versions are never candidates.</li>
 * </ol>
 * The policy is read on each selection.
 */
@Slf4j
@Component
public class VersionSelector {

    private final Supplier<VersionSelectionPolicyEnum> policySource;

    @Autowired
    public VersionSelector(PipelineParamsResolver paramsResolver) {
        this.policySource = paramsResolver::versionSelectionPolicy;
    }

    public VersionSelector(VersionSelectionPolicyEnum policy) {
        this.policySource = () -> policy;
    }

    public Optional<RegistryModelVersion> select(List<RegistryModelVersion> versions, String runId) {
        List<RegistryModelVersion> candidates = versions.stream()
                .filter(v -> v.stage() != ModelStageEnum.ARCHIVED)
                .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        VersionSelectionPolicyEnum policy = policySource.get();

        if (runId != null && !runId.isBlank()) {
            Optional<RegistryModelVersion> fromRun = candidates.stream()
                    .filter(v -> runId.equals(v.runId()))
                    .max(Comparator.comparingLong(RegistryModelVersion::numericVersion));
            if (fromRun.isPresent()) {
                log.info("🎯 Selected version {} registered by run {}", fromRun.get().version(), runId);
                return fromRun;
            }
            log.warn("⚠️ No registered version belongs to run {}, falling back to {} selection", runId, policy);
        }

        return switch (policy) {
            case HIGHEST_VERSION -> candidates.stream().max(Comparator.comparingLong(RegistryModelVersion::numericVersion));
            case FIRST_LISTED -> {
                log.warn("⚠️ Selecting the first listed version; registry order is unspecified");
                yield Optional.of(candidates.get(0));
            }
        };
    }
}
