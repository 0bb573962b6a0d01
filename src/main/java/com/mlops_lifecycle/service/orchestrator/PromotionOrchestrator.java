package com.mlops_lifecycle.service.orchestrator;

import com.mlops_lifecycle.config.PipelineParamsResolver;
import com.mlops_lifecycle.dto.metrics.EvaluationMetrics;
import com.mlops_lifecycle.dto.metrics.TrainingMetrics;
import com.mlops_lifecycle.dto.promotion.PromotionDecision;
import com.mlops_lifecycle.dto.promotion.PromotionParams;
import com.mlops_lifecycle.enumeration.PromotionExitCodeEnum;
import com.mlops_lifecycle.exception.ConfigurationException;
import com.mlops_lifecycle.exception.FileProcessingException;
import com.mlops_lifecycle.exception.MetricsUnavailableException;
import com.mlops_lifecycle.exception.ThresholdNotMetException;
import com.mlops_lifecycle.service.MetricsLoader;
import com.mlops_lifecycle.service.PromotionGate;
import com.mlops_lifecycle.service.RegistrySync;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One run of the promotion job: params, metrics, post-hoc metric logging, gate.
 * Every outcome is turned into an exit code here; nothing propagates to the process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromotionOrchestrator {

    private final PipelineParamsResolver paramsResolver;
    private final MetricsLoader metricsLoader;
    private final PromotionGate promotionGate;
    private final RegistrySync registrySync;

    public PromotionExitCodeEnum run() {
        try {
            PromotionDecision decision = promote();
            log.info("🏁 Promotion finished: outcome={}, registryVersion={}", decision.outcome(), decision.registryVersion());
            return PromotionExitCodeEnum.PROMOTED;
        } catch (ThresholdNotMetException e) {
            log.error("❌ {}. Model NOT promoted to production", e.getMessage());
            return PromotionExitCodeEnum.THRESHOLD_NOT_MET;
        } catch (ConfigurationException | MetricsUnavailableException e) {
            log.error("❌ Promotion aborted: {}", e.getMessage());
            return PromotionExitCodeEnum.INVALID_INPUT;
        } catch (FileProcessingException e) {
            log.error("❌ Promotion failed while writing the production artifact: {}", e.getMessage(), e);
            return PromotionExitCodeEnum.PROMOTION_FAILED;
        }
    }

    PromotionDecision promote() {
        PromotionParams params = paramsResolver.resolvePromotion();
        EvaluationMetrics evaluation = metricsLoader.loadEvaluation(paramsResolver.evalMetricsPath());
        Optional<TrainingMetrics> training = metricsLoader.loadTraining(paramsResolver.trainMetricsPath());

        String runId = training.filter(TrainingMetrics::hasRunId).map(TrainingMetrics::runId).orElse(null);
        if (runId != null && params.registryConfigured()) {
            attachEvaluationToRun(runId, evaluation);
        }

        PromotionDecision decision = promotionGate.promote(evaluation, params, runId);
        if (!decision.isPromoted()) {
            throw new ThresholdNotMetException(decision.accuracy(), decision.threshold());
        }
        return decision;
    }

    private void attachEvaluationToRun(String runId, EvaluationMetrics evaluation) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("eval_accuracy", evaluation.accuracy());
        metrics.put("eval_precision", evaluation.precision());
        metrics.put("eval_recall", evaluation.recall());
        metrics.put("eval_f1_score", evaluation.f1Score());
        try {
            registrySync.logMetrics(runId, metrics);
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not attach evaluation metrics to run {}: {}", runId, e.getMessage());
        }
    }
}
