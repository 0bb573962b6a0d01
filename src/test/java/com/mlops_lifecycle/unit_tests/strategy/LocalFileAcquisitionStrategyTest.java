package com.mlops_lifecycle.unit_tests.strategy;

import com.mlops_lifecycle.config.PipelineParamsResolver;
import com.mlops_lifecycle.enumeration.ModelSourceEnum;
import com.mlops_lifecycle.strategy.AcquisitionResult;
import com.mlops_lifecycle.strategy.LocalFileAcquisitionStrategy;
import com.mlops_lifecycle.util.WekaModelFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LocalFileAcquisitionStrategyTest {

    @TempDir
    Path tempDir;

    private LocalFileAcquisitionStrategy strategyFor(Path modelPath) {
        MockEnvironment environment = new MockEnvironment()
                .withProperty(PipelineParamsResolver.SERVE_MODEL_PATH, modelPath.toString())
                .withProperty(PipelineParamsResolver.MODEL_NAME, "iris-classifier");
        return new LocalFileAcquisitionStrategy(new PipelineParamsResolver(environment));
    }

    @Test
    @DisplayName("Should load the local production artifact")
    void acquire_ExistingFile_Loads() throws Exception {
        Path modelPath = WekaModelFixtures.writeModel(tempDir.resolve("production/model.model"));
        LocalFileAcquisitionStrategy strategy = strategyFor(modelPath);

        AcquisitionResult result = strategy.acquire();

        assertTrue(result.isSuccess());
        assertTrue(result.versionLabel().startsWith("local@"));
        assertEquals("iris-classifier", result.modelName());
        assertEquals(4, result.model().numFeatures());
        assertEquals(ModelSourceEnum.LOCAL, strategy.source());
    }

    @Test
    @DisplayName("Should fail when the artifact does not exist")
    void acquire_MissingFile_Fails() {
        AcquisitionResult result = strategyFor(tempDir.resolve("production/model.model")).acquire();

        assertFalse(result.isSuccess());
        assertTrue(result.failureReason().contains("model not found"));
    }

    @Test
    @DisplayName("Should fail when the artifact is not a model")
    void acquire_CorruptFile_Fails() throws Exception {
        Path modelPath = Files.writeString(tempDir.resolve("model.model"), "not a model");

        assertFalse(strategyFor(modelPath).acquire().isSuccess());
    }
}
