package com.mlops_lifecycle.strategy;

import com.mlops_lifecycle.config.PipelineParamsResolver;
import com.mlops_lifecycle.dto.registry.RegistryArtifact;
import com.mlops_lifecycle.enumeration.ModelSourceEnum;
import com.mlops_lifecycle.model.LoadedModel;
import com.mlops_lifecycle.service.RegistrySync;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Loads the version currently in the registry's Production stage.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class RegistryAcquisitionStrategy implements ModelAcquisitionStrategy {

    private final RegistrySync registrySync;
    private final PipelineParamsResolver paramsResolver;

    @Override
    public ModelSourceEnum source() {
        return ModelSourceEnum.REGISTRY;
    }

    @Override
    public AcquisitionResult acquire() {
        String modelName = paramsResolver.modelName();
        if (modelName == null) {
            return AcquisitionResult.failed("registry model name is not configured");
        }

        RegistryArtifact artifact = null;
        try {
            Optional<RegistryArtifact> fetched = registrySync.fetchProduction(modelName);
            if (fetched.isEmpty()) {
                return AcquisitionResult.failed("no version of '" + modelName + "' is in Production");
            }
            artifact = fetched.get();
            LoadedModel model = LoadedModel.read(artifact.localFile());
            return AcquisitionResult.succeeded(model, artifact.version().version(), modelName);
        } catch (RuntimeException e) {
            return AcquisitionResult.failed(e.getMessage());
        } finally {
            if (artifact != null) {
                FileUtils.deleteQuietly(artifact.localFile().toFile());
            }
        }
    }
}
