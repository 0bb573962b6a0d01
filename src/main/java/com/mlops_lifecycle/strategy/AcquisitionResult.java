package com.mlops_lifecycle.strategy;

import com.mlops_lifecycle.model.LoadedModel;

public record AcquisitionResult(
        LoadedModel model,          // null on failure
        String versionLabel,
        String modelName,
        String failureReason        // null on success
) {
    public static AcquisitionResult succeeded(LoadedModel model, String versionLabel, String modelName) {
        return new AcquisitionResult(model, versionLabel, modelName, null);
    }

    public static AcquisitionResult failed(String reason) {
        return new AcquisitionResult(null, null, null, reason);
    }

    public boolean isSuccess() {
        return model != null;
    }
}
