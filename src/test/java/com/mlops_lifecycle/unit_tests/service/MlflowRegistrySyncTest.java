package com.mlops_lifecycle.unit_tests.service;

import com.mlops_lifecycle.dto.registry.RegistryArtifact;
import com.mlops_lifecycle.dto.registry.RegistryModelVersion;
import com.mlops_lifecycle.enumeration.ModelStageEnum;
import com.mlops_lifecycle.exception.RegistryUnavailableException;
import com.mlops_lifecycle.service.MinioService;
import com.mlops_lifecycle.service.MlflowRegistrySync;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class MlflowRegistrySyncTest {

    private static final String TRACKING_URI = "http://registry:5000";
    private static final String MODEL_NAME = "iris-classifier";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private MinioService minioService;
    private MlflowRegistrySync registrySync;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        minioService = mock(MinioService.class);
        registrySync = new MlflowRegistrySync(restTemplate, minioService, TRACKING_URI + "/", "model.model");
    }

    private static RegistryModelVersion version(String version, ModelStageEnum stage) {
        return new RegistryModelVersion(MODEL_NAME, version, stage, "run-" + version, null, null);
    }

    @Nested
    @DisplayName("Version listing and stage transition")
    class VersionTests {

        @Test
        @DisplayName("Should parse every registered version with its stage")
        void listVersions_ParsesResponse() {
            // Given
            server.expect(requestTo(startsWith(TRACKING_URI + "/api/2.0/mlflow/model-versions/search")))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("""
                            {"model_versions": [
                              {"name": "iris-classifier", "version": "1", "current_stage": "Production", "run_id": "r1"},
                              {"name": "iris-classifier", "version": "2", "current_stage": "None", "run_id": "r2", "extra": true}
                            ]}
                            """, MediaType.APPLICATION_JSON));

            // When
            List<RegistryModelVersion> versions = registrySync.listVersions(MODEL_NAME);

            // Then
            server.verify();
            assertEquals(2, versions.size());
            assertEquals(ModelStageEnum.PRODUCTION, versions.get(0).stage());
            assertEquals("r2", versions.get(1).runId());
            assertEquals(ModelStageEnum.NONE, versions.get(1).stage());
        }

        @Test
        @DisplayName("Should treat a body without versions as an empty list")
        void listVersions_EmptyBody_ReturnsEmptyList() {
            server.expect(requestTo(startsWith(TRACKING_URI + "/api/2.0/mlflow/model-versions/search")))
                    .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

            assertTrue(registrySync.listVersions(MODEL_NAME).isEmpty());
        }

        @Test
        @DisplayName("Should request the transition with archiving of the previous Production version")
        void transitionStage_SendsArchiveFlag() {
            server.expect(requestTo(TRACKING_URI + "/api/2.0/mlflow/model-versions/transition-stage"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.name").value(MODEL_NAME))
                    .andExpect(jsonPath("$.version").value("3"))
                    .andExpect(jsonPath("$.stage").value("Production"))
                    .andExpect(jsonPath("$.archive_existing_versions").value(true))
                    .andRespond(withSuccess("""
                            {"model_version": {"name": "iris-classifier", "version": "3", "current_stage": "Production"}}
                            """, MediaType.APPLICATION_JSON));

            RegistryModelVersion moved = registrySync.transitionStage(MODEL_NAME, "3", ModelStageEnum.PRODUCTION, true);

            server.verify();
            assertEquals(ModelStageEnum.PRODUCTION, moved.stage());
        }

        @Test
        @DisplayName("Should pick the newest Production version")
        void findProductionVersion_ReturnsHighest() {
            server.expect(requestTo(TRACKING_URI + "/api/2.0/mlflow/registered-models/get-latest-versions"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.stages[0]").value("Production"))
                    .andRespond(withSuccess("""
                            {"model_versions": [
                              {"name": "iris-classifier", "version": "4", "current_stage": "Production"},
                              {"name": "iris-classifier", "version": "12", "current_stage": "Production"}
                            ]}
                            """, MediaType.APPLICATION_JSON));

            Optional<RegistryModelVersion> production = registrySync.findProductionVersion(MODEL_NAME);

            assertEquals("12", production.orElseThrow().version());
        }

        @Test
        @DisplayName("Should report no Production version when the registry has none")
        void findProductionVersion_None_ReturnsEmpty() {
            server.expect(requestTo(TRACKING_URI + "/api/2.0/mlflow/registered-models/get-latest-versions"))
                    .andRespond(withSuccess("{\"model_versions\": []}", MediaType.APPLICATION_JSON));

            assertTrue(registrySync.findProductionVersion(MODEL_NAME).isEmpty());
        }
    }

    @Nested
    @DisplayName("Registry failures")
    class FailureTests {

        @Test
        @DisplayName("Should report a server error as registry unavailable")
        void listVersions_ServerError_ThrowsRegistryUnavailable() {
            server.expect(requestTo(startsWith(TRACKING_URI)))
                    .andRespond(withServerError());

            assertThrows(RegistryUnavailableException.class, () -> registrySync.listVersions(MODEL_NAME));
        }

        @Test
        @DisplayName("Should report a timeout as registry unavailable")
        void transitionStage_Timeout_ThrowsRegistryUnavailable() {
            server.expect(requestTo(startsWith(TRACKING_URI)))
                    .andRespond(withException(new SocketTimeoutException("Read timed out")));

            RegistryUnavailableException ex = assertThrows(RegistryUnavailableException.class,
                    () -> registrySync.transitionStage(MODEL_NAME, "1", ModelStageEnum.PRODUCTION, true));
            assertTrue(ex.getMessage().contains("Read timed out"));
        }

        @Test
        @DisplayName("Should fail fast without a tracking URI")
        void anyCall_NoTrackingUri_ThrowsRegistryUnavailable() {
            MlflowRegistrySync unconfigured = new MlflowRegistrySync(restTemplate, minioService, "  ", "model.model");

            assertThrows(RegistryUnavailableException.class, () -> unconfigured.listVersions(MODEL_NAME));
            assertThrows(RegistryUnavailableException.class, () -> unconfigured.findProductionVersion(MODEL_NAME));
            server.verify();
        }
    }

    @Nested
    @DisplayName("Artifact download")
    class DownloadTests {

        @Test
        @DisplayName("Should copy a file:// artifact into a temp file")
        void downloadArtifact_FileScheme_CopiesToTemp() throws Exception {
            // Given
            Path artifactDir = Files.createDirectories(tempDir.resolve("artifacts/7/model"));
            Files.write(artifactDir.resolve("model.model"), new byte[]{1, 2, 3});
            server.expect(requestTo(startsWith(TRACKING_URI + "/api/2.0/mlflow/model-versions/get-download-uri")))
                    .andRespond(withSuccess("{\"artifact_uri\": \"" + artifactDir.toUri() + "\"}", MediaType.APPLICATION_JSON));

            // When
            Path downloaded = registrySync.downloadArtifact(version("7", ModelStageEnum.PRODUCTION));

            // Then
            try {
                assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(downloaded));
            } finally {
                Files.deleteIfExists(downloaded);
            }
        }

        @Test
        @DisplayName("Should fetch an s3:// artifact from the artifact store")
        void downloadArtifact_S3Scheme_UsesArtifactStore() {
            Path expected = tempDir.resolve("downloaded.model");
            when(minioService.parseS3Uri(anyString())).thenCallRealMethod();
            when(minioService.downloadObjectToTempFile("mlflow", "1/abc/artifacts/model/model.model")).thenReturn(expected);
            server.expect(requestTo(startsWith(TRACKING_URI + "/api/2.0/mlflow/model-versions/get-download-uri")))
                    .andRespond(withSuccess("{\"artifact_uri\": \"s3://mlflow/1/abc/artifacts/model\"}", MediaType.APPLICATION_JSON));

            Path downloaded = registrySync.downloadArtifact(version("2", ModelStageEnum.PRODUCTION));

            assertEquals(expected, downloaded);
        }

        @Test
        @DisplayName("Should reject an unsupported artifact scheme")
        void downloadArtifact_UnsupportedScheme_ThrowsRegistryUnavailable() {
            server.expect(requestTo(startsWith(TRACKING_URI + "/api/2.0/mlflow/model-versions/get-download-uri")))
                    .andRespond(withSuccess("{\"artifact_uri\": \"gs://bucket/model\"}", MediaType.APPLICATION_JSON));

            assertThrows(RegistryUnavailableException.class,
                    () -> registrySync.downloadArtifact(version("2", ModelStageEnum.PRODUCTION)));
            verifyNoInteractions(minioService);
        }

        @Test
        @DisplayName("Should fetch the whole Production artifact in one call")
        void fetchProduction_ResolvesVersionAndDownloads() throws Exception {
            Path artifactDir = Files.createDirectories(tempDir.resolve("artifacts/5/model"));
            Files.write(artifactDir.resolve("model.model"), new byte[]{9});
            server.expect(requestTo(TRACKING_URI + "/api/2.0/mlflow/registered-models/get-latest-versions"))
                    .andRespond(withSuccess("""
                            {"model_versions": [{"name": "iris-classifier", "version": "5", "current_stage": "Production"}]}
                            """, MediaType.APPLICATION_JSON));
            server.expect(requestTo(startsWith(TRACKING_URI + "/api/2.0/mlflow/model-versions/get-download-uri")))
                    .andRespond(withSuccess("{\"artifact_uri\": \"" + artifactDir.toUri() + "\"}", MediaType.APPLICATION_JSON));

            RegistryArtifact artifact = registrySync.fetchProduction(MODEL_NAME).orElseThrow();

            server.verify();
            assertEquals("5", artifact.version().version());
            Files.deleteIfExists(artifact.localFile());
        }
    }

    @Test
    @DisplayName("Should post non-null metrics to the training run")
    void logMetrics_PostsBatchForRun() {
        server.expect(requestTo(TRACKING_URI + "/api/2.0/mlflow/runs/log-batch"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.run_id").value("run-42"))
                .andExpect(jsonPath("$.metrics.length()").value(1))
                .andExpect(jsonPath("$.metrics[0].key").value("eval_accuracy"))
                .andExpect(jsonPath("$.metrics[0].value").value(0.95))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("eval_accuracy", 0.95);
        metrics.put("eval_precision", null);
        registrySync.logMetrics("run-42", metrics);

        server.verify();
    }
}
