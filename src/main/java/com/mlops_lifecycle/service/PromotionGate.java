package com.mlops_lifecycle.service;

import com.mlops_lifecycle.dto.metrics.EvaluationMetrics;
import com.mlops_lifecycle.dto.promotion.PromotionDecision;
import com.mlops_lifecycle.dto.promotion.PromotionParams;
import com.mlops_lifecycle.dto.registry.RegistryModelVersion;
import com.mlops_lifecycle.enumeration.ModelStageEnum;
import com.mlops_lifecycle.exception.MetricsUnavailableException;
import com.mlops_lifecycle.exception.RegistryUnavailableException;
import com.mlops_lifecycle.util.ArtifactFileUtil;
import com.mlops_lifecycle.util.ProductionPathLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Accuracy gate between the staging and the production artifact.
 *
 * <p>A passing model is copied to the production path first; the registry transition follows and is
 * best-effort. The local copy is the authoritative production artifact, so a registry failure is
 * logged and never undoes it. A rejected model causes no side effects at all.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionGate {

    private final RegistrySync registrySync;
    private final VersionSelector versionSelector;
    private final ProductionPathLock productionPathLock;

    public PromotionDecision promote(EvaluationMetrics metrics, PromotionParams params) {
        return promote(metrics, params, null);
    }

    /**
     * @param runId training run that produced the staging artifact, used to find its registry version; nullable
     */
    public PromotionDecision promote(EvaluationMetrics metrics, PromotionParams params, String runId) {
        if (metrics == null || metrics.accuracy() == null) {
            throw new MetricsUnavailableException("Evaluation record carries no accuracy");
        }
        double accuracy = metrics.accuracy();
        if (Double.isNaN(accuracy)) {
            throw new MetricsUnavailableException("Evaluation accuracy is not a number");
        }
        double threshold = params.minAccuracy();

        log.info("Model Accuracy: {}", String.format("%.4f", accuracy));
        log.info("Minimum Required Accuracy: {}", String.format("%.4f", threshold));

        if (accuracy < threshold) {
            log.warn("❌ Model accuracy {} is below threshold {}, model NOT promoted to production",
                    String.format("%.4f", accuracy), String.format("%.4f", threshold));
            return PromotionDecision.rejected(accuracy, threshold);
        }

        return productionPathLock.withLock(params.productionModel(), () -> {
            ArtifactFileUtil.copyAtomically(params.stagingModel(), params.productionModel());
            log.info("✅ Model promoted to production: {}", params.productionModel());

            String registryVersion = transitionInRegistry(params, runId);
            return PromotionDecision.promoted(accuracy, threshold, registryVersion);
        });
    }

    private String transitionInRegistry(PromotionParams params, String runId) {
        if (!params.registryConfigured()) {
            log.warn("⚠️ Registry not configured, skipping stage transition");
            return null;
        }

        String modelName = params.modelName();
        try {
            List<RegistryModelVersion> versions = registrySync.listVersions(modelName);
            RegistryModelVersion candidate = versionSelector.select(versions, runId)
                    .orElseThrow(() -> new RegistryUnavailableException("No registered version of '" + modelName + "' to promote"));

            registrySync.transitionStage(modelName, candidate.version(), ModelStageEnum.PRODUCTION, true);
            log.info("✅ Registry: '{}' v{} is now in Production", modelName, candidate.version());
            return candidate.version();
        } catch (RuntimeException e) {
            log.warn("⚠️ Registry transition failed, local promotion stands: {}", e.getMessage());
            return null;
        }
    }
}
