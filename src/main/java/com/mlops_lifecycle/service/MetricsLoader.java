package com.mlops_lifecycle.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlops_lifecycle.dto.metrics.EvaluationMetrics;
import com.mlops_lifecycle.dto.metrics.TrainingMetrics;
import com.mlops_lifecycle.exception.MetricsUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the JSON records left behind by the external training and evaluation steps.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsLoader {

    private final ObjectMapper objectMapper;

    public EvaluationMetrics loadEvaluation(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new MetricsUnavailableException("Evaluation record not found: " + path);
        }

        EvaluationMetrics metrics;
        try (InputStream is = Files.newInputStream(path)) {
            metrics = objectMapper.readValue(is, EvaluationMetrics.class);
        } catch (IOException e) {
            throw new MetricsUnavailableException("Evaluation record " + path + " is unreadable: " + e.getMessage(), e);
        }

        if (metrics == null || metrics.accuracy() == null) {
            throw new MetricsUnavailableException("Evaluation record " + path + " has no 'accuracy'");
        }
        log.info("📥 Loaded evaluation record {} (accuracy={})", path, metrics.accuracy());
        return metrics;
    }

    /**
     * The training record is optional; a missing or unreadable one only means no run id is known.
     */
    public Optional<TrainingMetrics> loadTraining(Path path) {
        if (!Files.isRegularFile(path)) {
            log.info("📭 No training record at {}", path);
            return Optional.empty();
        }

        try (InputStream is = Files.newInputStream(path)) {
            return Optional.ofNullable(objectMapper.readValue(is, TrainingMetrics.class));
        } catch (IOException e) {
            log.warn("⚠️ Ignoring unreadable training record {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
