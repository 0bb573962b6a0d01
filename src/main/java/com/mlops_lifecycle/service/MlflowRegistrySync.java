package com.mlops_lifecycle.service;

import com.mlops_lifecycle.dto.registry.DownloadUriResponse;
import com.mlops_lifecycle.dto.registry.LatestVersionsRequest;
import com.mlops_lifecycle.dto.registry.LogBatchRequest;
import com.mlops_lifecycle.dto.registry.ModelVersionListResponse;
import com.mlops_lifecycle.dto.registry.ModelVersionResponse;
import com.mlops_lifecycle.dto.registry.RegistryModelVersion;
import com.mlops_lifecycle.dto.registry.TransitionStageRequest;
import com.mlops_lifecycle.enumeration.ModelStageEnum;
import com.mlops_lifecycle.exception.RegistryUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link RegistrySync} over the MLflow tracking server REST API (2.0). Artifacts are read from
 * the S3-compatible store behind the registry, from the server's artifact proxy, or from the
 * local filesystem, depending on the scheme of the version's download URI.
 */
@Slf4j
@Service
public class MlflowRegistrySync implements RegistrySync {

    static final String SEARCH_VERSIONS = "/api/2.0/mlflow/model-versions/search";
    static final String TRANSITION_STAGE = "/api/2.0/mlflow/model-versions/transition-stage";
    static final String LATEST_VERSIONS = "/api/2.0/mlflow/registered-models/get-latest-versions";
    static final String DOWNLOAD_URI = "/api/2.0/mlflow/model-versions/get-download-uri";
    static final String LOG_BATCH = "/api/2.0/mlflow/runs/log-batch";
    static final String ARTIFACT_PROXY = "/api/2.0/mlflow-artifacts/artifacts/";

    private final RestTemplate restTemplate;
    private final MinioService minioService;
    private final String trackingUri;
    private final String artifactFile;

    public MlflowRegistrySync(@Qualifier("registryRestTemplate") RestTemplate restTemplate,
                              MinioService minioService,
                              @Value("${registry.tracking_uri:}") String trackingUri,
                              @Value("${registry.artifact_file:model.model}") String artifactFile) {
        this.restTemplate = restTemplate;
        this.minioService = minioService;
        this.trackingUri = trackingUri == null ? "" : trackingUri.trim().replaceFirst("/+$", "");
        this.artifactFile = artifactFile;
    }

    @Override
    public List<RegistryModelVersion> listVersions(String modelName) {
        ModelVersionListResponse response = call("list versions of '" + modelName + "'", () ->
                restTemplate.getForObject(baseUrl() + SEARCH_VERSIONS + "?filter={filter}",
                        ModelVersionListResponse.class, "name='" + modelName + "'"));
        log.info("📋 Registry lists {} version(s) of '{}'", response.modelVersions().size(), modelName);
        return response.modelVersions();
    }

    @Override
    public RegistryModelVersion transitionStage(String modelName, String version, ModelStageEnum stage, boolean archiveExisting) {
        TransitionStageRequest request = new TransitionStageRequest(modelName, version, stage.getRegistryName(), archiveExisting);
        ModelVersionResponse response = call("transition '" + modelName + "' v" + version + " to " + stage.getRegistryName(), () ->
                restTemplate.postForObject(baseUrl() + TRANSITION_STAGE, request, ModelVersionResponse.class));
        if (response.modelVersion() == null) {
            throw new RegistryUnavailableException("Registry returned no model version for transition of '" + modelName + "' v" + version);
        }
        log.info("✅ Registry moved '{}' v{} to {} (archiveExisting={})", modelName, version, stage.getRegistryName(), archiveExisting);
        return response.modelVersion();
    }

    @Override
    public Optional<RegistryModelVersion> findProductionVersion(String modelName) {
        LatestVersionsRequest request = new LatestVersionsRequest(modelName, List.of(ModelStageEnum.PRODUCTION.getRegistryName()));
        ModelVersionListResponse response = call("find Production version of '" + modelName + "'", () ->
                restTemplate.postForObject(baseUrl() + LATEST_VERSIONS, request, ModelVersionListResponse.class));
        return response.modelVersions().stream()
                .filter(v -> v.stage() == ModelStageEnum.PRODUCTION)
                .max(Comparator.comparingLong(RegistryModelVersion::numericVersion));
    }

    @Override
    public Path downloadArtifact(RegistryModelVersion version) {
        DownloadUriResponse response = call("resolve artifact of '" + version.name() + "' v" + version.version(), () ->
                restTemplate.getForObject(baseUrl() + DOWNLOAD_URI + "?name={name}&version={version}",
                        DownloadUriResponse.class, version.name(), version.version()));
        String artifactUri = response.artifactUri();
        if (artifactUri == null || artifactUri.isBlank()) {
            throw new RegistryUnavailableException("Registry returned no artifact URI for '" + version.name() + "' v" + version.version());
        }

        log.info("📦 Fetching artifact '{}' from {}", artifactFile, artifactUri);
        try {
            String scheme = URI.create(artifactUri).getScheme();
            if ("s3".equalsIgnoreCase(scheme)) {
                MinioService.S3Location location = minioService.parseS3Uri(artifactUri);
                return minioService.downloadObjectToTempFile(location.bucket(), location.resolve(artifactFile));
            }
            if ("mlflow-artifacts".equalsIgnoreCase(scheme)) {
                return downloadThroughProxy(artifactUri);
            }
            if ("file".equalsIgnoreCase(scheme)) {
                return copyToTemp(Path.of(URI.create(artifactUri)).resolve(artifactFile));
            }
        } catch (RegistryUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RegistryUnavailableException("Failed to fetch artifact " + artifactUri + ": " + e.getMessage(), e);
        }
        throw new RegistryUnavailableException("Unsupported artifact URI scheme: " + artifactUri);
    }

    @Override
    public void logMetrics(String runId, Map<String, Double> metrics) {
        long now = Instant.now().toEpochMilli();
        List<LogBatchRequest.MetricEntry> entries = metrics.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> new LogBatchRequest.MetricEntry(e.getKey(), e.getValue(), now, 0))
                .toList();
        LogBatchRequest request = new LogBatchRequest(runId, entries);
        call("log metrics to run " + runId, () -> {
            restTemplate.postForObject(baseUrl() + LOG_BATCH, request, Map.class);
            return Boolean.TRUE;
        });
        log.info("📊 Logged {} metric(s) to registry run {}", entries.size(), runId);
    }

    private Path downloadThroughProxy(String artifactUri) {
        String artifactPath = URI.create(artifactUri).getPath().replaceFirst("^/+", "").replaceFirst("/+$", "");
        byte[] body = call("download " + artifactUri, () ->
                restTemplate.getForObject(baseUrl() + ARTIFACT_PROXY + artifactPath + "/" + artifactFile, byte[].class));
        try {
            Path tempFile = Files.createTempFile("registry-", "-" + artifactFile);
            Files.write(tempFile, body);
            return tempFile;
        } catch (IOException e) {
            throw new RegistryUnavailableException("Failed to store downloaded artifact: " + e.getMessage(), e);
        }
    }

    private Path copyToTemp(Path source) {
        try {
            Path tempFile = Files.createTempFile("registry-", "-" + artifactFile);
            Files.copy(source, tempFile, StandardCopyOption.REPLACE_EXISTING);
            return tempFile;
        } catch (IOException e) {
            throw new RegistryUnavailableException("Failed to read artifact " + source + ": " + e.getMessage(), e);
        }
    }

    private String baseUrl() {
        if (trackingUri.isEmpty()) {
            throw new RegistryUnavailableException("Registry tracking URI is not configured");
        }
        return trackingUri;
    }

    private <T> T call(String operation, Supplier<T> request) {
        T body;
        try {
            body = request.get();
        } catch (RegistryUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Registry call failed: {}", operation, e);
            throw new RegistryUnavailableException("Registry unavailable, could not " + operation + ": " + e.getMessage(), e);
        }
        if (body == null) {
            throw new RegistryUnavailableException("Registry returned an empty body, could not " + operation);
        }
        return body;
    }
}
