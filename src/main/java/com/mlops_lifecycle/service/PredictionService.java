package com.mlops_lifecycle.service;

import com.mlops_lifecycle.dto.serving.ModelInfoResponse;
import com.mlops_lifecycle.dto.serving.PredictionRequest;
import com.mlops_lifecycle.dto.serving.PredictionResponse;
import com.mlops_lifecycle.dto.serving.ServerStatusResponse;
import com.mlops_lifecycle.exception.PredictionException;
import com.mlops_lifecycle.exception.PredictionInputException;
import com.mlops_lifecycle.model.LoadedModel;
import com.mlops_lifecycle.model.Prediction;
import com.mlops_lifecycle.model.ServerModelState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@ConditionalOnWebApplication
@RequiredArgsConstructor
public class PredictionService {

    public static final String API_TITLE = "MLOps Model Serving API";

    private final ServerModelState state;

    public ServerStatusResponse status() {
        return new ServerStatusResponse(API_TITLE, "running", state.isReady(), state.getSource(), state.getVersionLabel());
    }

    public ServerStatusResponse health() {
        return new ServerStatusResponse(null, "healthy", state.isReady(), state.getSource(), state.getVersionLabel());
    }

    public ModelInfoResponse modelInfo() {
        LoadedModel model = state.requireModel();
        return ModelInfoResponse.builder()
                .name(state.getModelName())
                .version(state.getVersionLabel())
                .source(state.getSource())
                .algorithm(model.getAlgorithm())
                .numFeatures(model.numFeatures())
                .featureNames(model.getFeatureNames())
                .classLabels(model.getClassLabels())
                .loadedAt(state.getLoadedAt())
                .build();
    }

    /**
     * Availability is checked before the input: an unavailable server answers 503 to any request.
     */
    public PredictionResponse predict(PredictionRequest request) {
        LoadedModel model = state.requireModel();
        if (request == null || request.getFeatures() == null) {
            throw new PredictionInputException("Request must contain a 'features' array");
        }

        Prediction prediction;
        try {
            prediction = model.predict(request.getFeatures());
        } catch (PredictionInputException e) {
            log.warn("⚠️ Rejected prediction input: {}", e.getMessage());
            throw e;
        } catch (PredictionException e) {
            log.error("❌ Prediction failed: {}", e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("❌ Prediction failed: {}", e.getMessage(), e);
            throw new PredictionException(String.valueOf(e.getMessage()), e);
        }

        return PredictionResponse.builder()
                .prediction(prediction.classIndex())
                .label(prediction.label())
                .probability(prediction.probability())
                .modelVersion(state.getVersionLabel())
                .modelSource(state.getSource())
                .build();
    }
}
