package com.mlops_lifecycle.service;

import com.mlops_lifecycle.exception.FileProcessingException;
import io.minio.GetObjectArgs;
import io.minio.MinioClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads registry artifacts out of the S3-compatible artifact store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MinioService {

    private final MinioClient minioClient;

    public Path downloadObjectToTempFile(String bucketName, String objectKey) {
        log.info("📥 Downloading [{}]/[{}] from artifact store...", bucketName, objectKey);

        Path tempFile = null;
        try (InputStream inputStream = loadObjectAsInputStream(bucketName, objectKey)) {
            String safeName = objectKey.replace("/", "_");
            tempFile = Files.createTempFile("registry-", "-" + safeName);
            Files.copy(inputStream, tempFile, StandardCopyOption.REPLACE_EXISTING);

            if (!Files.isRegularFile(tempFile)) {
                throw new FileProcessingException("❌ File is not regular file: " + tempFile);
            }

            log.info("✅ Temp file saved at: {}", tempFile.toAbsolutePath());
            return tempFile;
        } catch (IOException e) {
            deleteIfPresent(tempFile);
            throw new FileProcessingException("Failed to download file from artifact store: " + objectKey, e);
        }
    }

    public InputStream loadObjectAsInputStream(String bucketName, String objectKey) {
        try {
            return minioClient.getObject(
                    GetObjectArgs.builder()
                            .bucket(bucketName)
                            .object(objectKey)
                            .build()
            );
        } catch (Exception e) {
            throw new FileProcessingException("Error fetching file from artifact store: " + e.getMessage(), e);
        }
    }

    /**
     * Splits an {@code s3://bucket/key} URI into bucket and object key.
     */
    public S3Location parseS3Uri(String s3Uri) {
        if (s3Uri == null || s3Uri.isBlank()) {
            throw new IllegalArgumentException("Artifact URI cannot be null or empty");
        }

        try {
            URI uri = new URI(s3Uri);
            if (!"s3".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) {
                throw new IllegalArgumentException("Not an s3:// URI: " + s3Uri);
            }
            String key = uri.getPath() == null ? "" : uri.getPath().replaceFirst("^/+", "");
            return new S3Location(uri.getHost(), key);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid artifact URI: " + s3Uri, e);
        }
    }

    private static void deleteIfPresent(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("⚠️ Could not delete partial download {}: {}", file, e.getMessage());
        }
    }

    public record S3Location(String bucket, String key) {

        public String resolve(String fileName) {
            return key.isEmpty() ? fileName : key.replaceFirst("/+$", "") + "/" + fileName;
        }
    }
}
