package com.mlops_lifecycle.config;

import io.minio.MinioClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Client for the S3-compatible store that holds the registry's model artifacts.
 * Building the client does not contact the store, so an unreachable store never blocks startup.
 */
@Configuration
public class MinioConfig {

    @Value("${minio.url:http://localhost:9000}")
    private String url;

    @Value("${minio.access.name:}")
    private String accessKey;

    @Value("${minio.access.secret:}")
    private String secretKey;

    @Value("${registry.timeout_ms:5000}")
    private long timeoutMs;

    private static final Logger log = LoggerFactory.getLogger(MinioConfig.class);

    @Bean
    public MinioClient minioClient() {
        MinioClient.Builder builder = MinioClient.builder().endpoint(url);
        if (!accessKey.isBlank() && !secretKey.isBlank()) {
            builder.credentials(accessKey, secretKey);
        } else {
            log.info("No artifact store credentials configured, using anonymous access to {}", url);
        }

        MinioClient minioClient = builder.build();
        minioClient.setTimeout(timeoutMs, timeoutMs, timeoutMs);
        return minioClient;
    }
}
