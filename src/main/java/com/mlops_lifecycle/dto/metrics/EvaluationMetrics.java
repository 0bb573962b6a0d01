package com.mlops_lifecycle.dto.metrics;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Evaluation record written by the external evaluation step, computed on the held-out split.
 * Only {@code accuracy} is required by the promotion gate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationMetrics(
        Double accuracy,
        Double precision,
        Double recall,
        @JsonProperty("f1_score") @JsonAlias("f1") Double f1Score,
        @JsonProperty("confusion_matrix") List<List<Integer>> confusionMatrix
) {
    public EvaluationMetrics {
        confusionMatrix = confusionMatrix == null
                ? List.of()
                : confusionMatrix.stream().map(List::copyOf).toList();
    }

    public static EvaluationMetrics ofAccuracy(double accuracy) {
        return new EvaluationMetrics(accuracy, null, null, null, null);
    }
}
