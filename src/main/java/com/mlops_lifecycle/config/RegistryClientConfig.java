package com.mlops_lifecycle.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the model registry. Every call is bounded by {@code registry.timeout_ms} so an
 * unreachable registry turns into a failure instead of a hang.
 */
@Configuration
public class RegistryClientConfig {

    @Value("${registry.timeout_ms:5000}")
    private int timeoutMs;

    @Bean
    public RestTemplate registryRestTemplate() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        return new RestTemplate(requestFactory);
    }
}
