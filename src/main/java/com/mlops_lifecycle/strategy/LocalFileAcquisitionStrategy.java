package com.mlops_lifecycle.strategy;

import com.mlops_lifecycle.config.PipelineParamsResolver;
import com.mlops_lifecycle.enumeration.ModelSourceEnum;
import com.mlops_lifecycle.exception.ModelLoadException;
import com.mlops_lifecycle.model.LoadedModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the local production artifact written by the promotion gate.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class LocalFileAcquisitionStrategy implements ModelAcquisitionStrategy {

    private final PipelineParamsResolver paramsResolver;

    @Override
    public ModelSourceEnum source() {
        return ModelSourceEnum.LOCAL;
    }

    @Override
    public AcquisitionResult acquire() {
        Path modelPath = paramsResolver.resolveServingModelPath();
        if (!Files.isRegularFile(modelPath)) {
            return AcquisitionResult.failed("model not found at " + modelPath.toAbsolutePath());
        }

        try {
            LoadedModel model = LoadedModel.read(modelPath);
            return AcquisitionResult.succeeded(model, versionLabel(modelPath), paramsResolver.modelName());
        } catch (ModelLoadException e) {
            return AcquisitionResult.failed(e.getMessage());
        }
    }

    private static String versionLabel(Path modelPath) {
        try {
            return "local@" + Files.getLastModifiedTime(modelPath).toInstant();
        } catch (IOException e) {
            log.debug("Could not read modification time of {}", modelPath, e);
            return "local";
        }
    }
}
