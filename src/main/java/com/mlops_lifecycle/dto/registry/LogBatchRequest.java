package com.mlops_lifecycle.dto.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LogBatchRequest(
        @JsonProperty("run_id") String runId,
        List<MetricEntry> metrics
) {
    public record MetricEntry(String key, double value, long timestamp, long step) {}
}
