package com.mlops_lifecycle.config;

import com.mlops_lifecycle.dto.promotion.PromotionParams;
import com.mlops_lifecycle.enumeration.VersionSelectionPolicyEnum;
import com.mlops_lifecycle.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Reads the pipeline parameters ({@code params.yaml} keys) out of the Spring environment.
 * Resolution is lazy so that a bad value fails the promotion job with its own exit code
 * instead of failing context startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineParamsResolver {

    public static final String MIN_ACCURACY = "promote.min_accuracy";
    public static final String STAGING_MODEL = "promote.staging_model";
    public static final String PRODUCTION_MODEL = "promote.production_model";
    public static final String TRACKING_URI = "registry.tracking_uri";
    public static final String MODEL_NAME = "registry.model_name";
    public static final String SERVE_MODEL_PATH = "serve.model_path";
    public static final String EVAL_METRICS_PATH = "metrics.eval_path";
    public static final String TRAIN_METRICS_PATH = "metrics.train_path";
    public static final String VERSION_SELECTION = "registry.version_selection";

    private final Environment environment;

    public PromotionParams resolvePromotion() {
        double minAccuracy = parseMinAccuracy(required(MIN_ACCURACY));
        Path staging = toPath(STAGING_MODEL, required(STAGING_MODEL));
        Path production = toPath(PRODUCTION_MODEL, required(PRODUCTION_MODEL));

        VersionSelectionPolicyEnum selection = versionSelectionPolicy();

        PromotionParams params = new PromotionParams(minAccuracy, staging, production, trackingUri(), modelName());
        log.info("⚙️ Promotion params: minAccuracy={}, staging={}, production={}, registry={}, versionSelection={}",
                minAccuracy, staging, production, params.registryConfigured() ? params.trackingUri() : "disabled", selection);
        return params;
    }

    public Path resolveServingModelPath() {
        String configured = environment.getProperty(SERVE_MODEL_PATH);
        if (isBlank(configured)) {
            configured = environment.getProperty(PRODUCTION_MODEL);
        }
        if (isBlank(configured)) {
            throw new ConfigurationException("Neither '" + SERVE_MODEL_PATH + "' nor '" + PRODUCTION_MODEL + "' is configured");
        }
        return toPath(SERVE_MODEL_PATH, configured);
    }

    public Path evalMetricsPath() {
        return toPath(EVAL_METRICS_PATH, environment.getProperty(EVAL_METRICS_PATH, "metrics/eval_metrics.json"));
    }

    public Path trainMetricsPath() {
        return toPath(TRAIN_METRICS_PATH, environment.getProperty(TRAIN_METRICS_PATH, "metrics/train_metrics.json"));
    }

    public VersionSelectionPolicyEnum versionSelectionPolicy() {
        String configured = environment.getProperty(VERSION_SELECTION);
        if (isBlank(configured)) {
            return VersionSelectionPolicyEnum.HIGHEST_VERSION;
        }
        try {
            return VersionSelectionPolicyEnum.fromConfig(configured);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("'" + VERSION_SELECTION + "' must be one of highest_version, first_listed but was " + configured, e);
        }
    }

    public String trackingUri() {
        return trimToNull(environment.getProperty(TRACKING_URI));
    }

    public String modelName() {
        return trimToNull(environment.getProperty(MODEL_NAME));
    }

    private String required(String key) {
        String value = environment.getProperty(key);
        if (isBlank(value)) {
            throw new ConfigurationException("Missing required configuration '" + key + "'");
        }
        return value.trim();
    }

    private static double parseMinAccuracy(String raw) {
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + MIN_ACCURACY + "' is not a number: " + raw, e);
        }
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException("'" + MIN_ACCURACY + "' must be within [0, 1] but was " + raw);
        }
        return value;
    }

    private static Path toPath(String key, String raw) {
        try {
            return Path.of(raw.trim());
        } catch (InvalidPathException e) {
            throw new ConfigurationException("'" + key + "' is not a valid path: " + raw, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
