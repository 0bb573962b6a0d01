package com.mlops_lifecycle.dto.metrics;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Training record. {@code mlflow_run_id} ties the staging artifact to a registry run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrainingMetrics(
        @JsonProperty("train_accuracy") Double trainAccuracy,
        @JsonProperty("test_accuracy") Double testAccuracy,
        Double precision,
        Double recall,
        @JsonProperty("f1_score") Double f1Score,
        @JsonProperty("mlflow_run_id") @JsonAlias("run_id") String runId
) {
    public boolean hasRunId() {
        return runId != null && !runId.isBlank();
    }
}
