package com.mlops_lifecycle.dto.promotion;

import java.nio.file.Path;

public record PromotionParams(
        double minAccuracy,
        Path stagingModel,
        Path productionModel,
        String trackingUri,     // nullable - registry disabled when blank
        String modelName        // nullable - registry disabled when blank
) {
    public boolean registryConfigured() {
        return trackingUri != null && !trackingUri.isBlank()
                && modelName != null && !modelName.isBlank();
    }
}
