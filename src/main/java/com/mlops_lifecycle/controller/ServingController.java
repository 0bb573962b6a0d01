package com.mlops_lifecycle.controller;

import com.mlops_lifecycle.dto.response.GenericResponse;
import com.mlops_lifecycle.dto.serving.ModelInfoResponse;
import com.mlops_lifecycle.dto.serving.PredictionRequest;
import com.mlops_lifecycle.dto.serving.PredictionResponse;
import com.mlops_lifecycle.dto.serving.ServerStatusResponse;
import com.mlops_lifecycle.service.PredictionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static org.springframework.http.MediaType.APPLICATION_JSON_VALUE;

@RestController
@ConditionalOnWebApplication
@RequiredArgsConstructor
@Slf4j
public class ServingController {

    private final PredictionService predictionService;

    @Operation(summary = "Service status", description = "Reports whether a model is loaded and where it came from")
    @GetMapping(path = "/", produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<ServerStatusResponse> root() {
        return ResponseEntity.ok(predictionService.status());
    }

    @Operation(summary = "Health check", description = "Always 200; model_loaded tells whether predictions can be served")
    @GetMapping(path = "/health", produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<ServerStatusResponse> health() {
        return ResponseEntity.ok(predictionService.health());
    }

    @Operation(summary = "Loaded model metadata")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Model metadata"),
            @ApiResponse(responseCode = "503", description = "Model not loaded",
                    content = @Content(schema = @Schema(implementation = GenericResponse.class)))
    })
    @GetMapping(path = "/model-info", produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<ModelInfoResponse> modelInfo() {
        return ResponseEntity.ok(predictionService.modelInfo());
    }

    @Operation(summary = "Predict", description = "Classifies one feature vector with the production model")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Prediction with class probabilities and model provenance"),
            @ApiResponse(responseCode = "400", description = "Feature vector does not fit the model, or the model failed on it",
                    content = @Content(schema = @Schema(implementation = GenericResponse.class))),
            @ApiResponse(responseCode = "503", description = "Model not loaded",
                    content = @Content(schema = @Schema(implementation = GenericResponse.class)))
    })
    @PostMapping(path = "/predict", consumes = APPLICATION_JSON_VALUE, produces = APPLICATION_JSON_VALUE)
    public ResponseEntity<PredictionResponse> predict(@RequestBody PredictionRequest request) {
        return ResponseEntity.ok(predictionService.predict(request));
    }
}
