package com.mlops_lifecycle.unit_tests.config;

import com.mlops_lifecycle.config.PipelineParamsResolver;
import com.mlops_lifecycle.dto.promotion.PromotionParams;
import com.mlops_lifecycle.enumeration.VersionSelectionPolicyEnum;
import com.mlops_lifecycle.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PipelineParamsResolverTest {

    private static MockEnvironment promotionEnvironment() {
        return new MockEnvironment()
                .withProperty(PipelineParamsResolver.MIN_ACCURACY, "0.9")
                .withProperty(PipelineParamsResolver.STAGING_MODEL, "models/staging/model.model")
                .withProperty(PipelineParamsResolver.PRODUCTION_MODEL, "models/production/model.model");
    }

    @Nested
    @DisplayName("Promotion params")
    class PromotionTests {

        @Test
        @DisplayName("Should resolve threshold and paths, with the registry disabled when not configured")
        void resolvePromotion_Minimal() {
            PromotionParams params = new PipelineParamsResolver(promotionEnvironment()).resolvePromotion();

            assertEquals(0.9, params.minAccuracy());
            assertEquals(Path.of("models/staging/model.model"), params.stagingModel());
            assertEquals(Path.of("models/production/model.model"), params.productionModel());
            assertFalse(params.registryConfigured());
        }

        @Test
        @DisplayName("Should enable the registry when both its keys are set")
        void resolvePromotion_WithRegistry() {
            MockEnvironment environment = promotionEnvironment()
                    .withProperty(PipelineParamsResolver.TRACKING_URI, " http://localhost:5000 ")
                    .withProperty(PipelineParamsResolver.MODEL_NAME, "iris-classifier");

            PromotionParams params = new PipelineParamsResolver(environment).resolvePromotion();

            assertTrue(params.registryConfigured());
            assertEquals("http://localhost:5000", params.trackingUri());
        }

        @ParameterizedTest
        @ValueSource(strings = {"1.5", "-0.1", "NaN", "high"})
        @DisplayName("Should reject a threshold outside [0, 1]")
        void resolvePromotion_BadThreshold_Throws(String threshold) {
            MockEnvironment environment = promotionEnvironment().withProperty(PipelineParamsResolver.MIN_ACCURACY, threshold);

            assertThrows(ConfigurationException.class, () -> new PipelineParamsResolver(environment).resolvePromotion());
        }

        @Test
        @DisplayName("Should accept the boundary thresholds")
        void resolvePromotion_BoundaryThresholds() {
            assertEquals(0.0, new PipelineParamsResolver(promotionEnvironment()
                    .withProperty(PipelineParamsResolver.MIN_ACCURACY, "0")).resolvePromotion().minAccuracy());
            assertEquals(1.0, new PipelineParamsResolver(promotionEnvironment()
                    .withProperty(PipelineParamsResolver.MIN_ACCURACY, "1.0")).resolvePromotion().minAccuracy());
        }

        @Test
        @DisplayName("Should default the version selection policy and reject unknown ones")
        void versionSelectionPolicy_DefaultAndUnknown() {
            assertEquals(VersionSelectionPolicyEnum.HIGHEST_VERSION,
                    new PipelineParamsResolver(promotionEnvironment()).versionSelectionPolicy());
            assertEquals(VersionSelectionPolicyEnum.FIRST_LISTED, new PipelineParamsResolver(promotionEnvironment()
                    .withProperty(PipelineParamsResolver.VERSION_SELECTION, "first-listed")).versionSelectionPolicy());

            MockEnvironment unknown = promotionEnvironment().withProperty(PipelineParamsResolver.VERSION_SELECTION, "newest");
            assertThrows(ConfigurationException.class, () -> new PipelineParamsResolver(unknown).resolvePromotion());
        }

        @Test
        @DisplayName("Should reject missing required keys")
        void resolvePromotion_MissingKeys_Throws() {
            MockEnvironment noStaging = new MockEnvironment()
                    .withProperty(PipelineParamsResolver.MIN_ACCURACY, "0.9")
                    .withProperty(PipelineParamsResolver.PRODUCTION_MODEL, "models/production/model.model");

            ConfigurationException ex = assertThrows(ConfigurationException.class,
                    () -> new PipelineParamsResolver(noStaging).resolvePromotion());
            assertTrue(ex.getMessage().contains(PipelineParamsResolver.STAGING_MODEL));
            assertThrows(ConfigurationException.class, () -> new PipelineParamsResolver(new MockEnvironment()).resolvePromotion());
        }
    }

    @Nested
    @DisplayName("Serving path")
    class ServingTests {

        @Test
        @DisplayName("Should prefer the explicit serving path")
        void resolveServingModelPath_Explicit() {
            MockEnvironment environment = promotionEnvironment().withProperty(PipelineParamsResolver.SERVE_MODEL_PATH, "/srv/model.model");

            assertEquals(Path.of("/srv/model.model"), new PipelineParamsResolver(environment).resolveServingModelPath());
        }

        @Test
        @DisplayName("Should fall back to the production path")
        void resolveServingModelPath_FallsBackToProduction() {
            assertEquals(Path.of("models/production/model.model"),
                    new PipelineParamsResolver(promotionEnvironment()).resolveServingModelPath());
        }

        @Test
        @DisplayName("Should fail when no model path is configured")
        void resolveServingModelPath_Nothing_Throws() {
            assertThrows(ConfigurationException.class, () -> new PipelineParamsResolver(new MockEnvironment()).resolveServingModelPath());
        }

        @Test
        @DisplayName("Should default the metrics record locations")
        void metricsPaths_Defaults() {
            PipelineParamsResolver resolver = new PipelineParamsResolver(new MockEnvironment());

            assertEquals(Path.of("metrics/eval_metrics.json"), resolver.evalMetricsPath());
            assertEquals(Path.of("metrics/train_metrics.json"), resolver.trainMetricsPath());
            assertNull(resolver.trackingUri());
            assertNull(resolver.modelName());
        }
    }
}
