package com.mlops_lifecycle.dto.promotion;

import com.mlops_lifecycle.enumeration.PromotionOutcomeEnum;

/**
 * Result of one gate evaluation. Never persisted, only turned into the job's exit code.
 *
 * @param registryVersion the registry version moved to Production, or null when the registry step
 *                        was skipped or failed
 */
public record PromotionDecision(
        double accuracy,
        double threshold,
        PromotionOutcomeEnum outcome,
        String registryVersion
) {
    public static PromotionDecision rejected(double accuracy, double threshold) {
        return new PromotionDecision(accuracy, threshold, PromotionOutcomeEnum.REJECTED, null);
    }

    public static PromotionDecision promoted(double accuracy, double threshold, String registryVersion) {
        return new PromotionDecision(accuracy, threshold, PromotionOutcomeEnum.PROMOTED, registryVersion);
    }

    public boolean isPromoted() {
        return outcome == PromotionOutcomeEnum.PROMOTED;
    }

    public boolean registrySynced() {
        return registryVersion != null;
    }
}
