package com.mlops_lifecycle.exception;

import com.mlops_lifecycle.dto.response.GenericResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ModelNotLoadedException.class)
    public ResponseEntity<GenericResponse<?>> handleModelNotLoaded(ModelNotLoadedException ex) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "MODEL_NOT_LOADED", ex.getMessage());
    }

    @ExceptionHandler(PredictionInputException.class)
    public ResponseEntity<GenericResponse<?>> handlePredictionInput(PredictionInputException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage());
    }

    @ExceptionHandler(PredictionException.class)
    public ResponseEntity<GenericResponse<?>> handlePrediction(PredictionException ex) {
        return respond(HttpStatus.BAD_REQUEST, "PREDICTION_ERROR", "Prediction error: " + ex.getMessage());
    }

    // Invalid/malformed JSON
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<GenericResponse<?>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("⚠️ Unreadable request body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_JSON", "Request body is invalid or malformed");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<GenericResponse<?>> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UNSUPPORTED_MEDIA_TYPE", ex.getMessage());
    }

    // Generic fallback
    @ExceptionHandler(Exception.class)
    public ResponseEntity<GenericResponse<?>> handleGenericException(Exception ex) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "Something went wrong. Please try again later.");
    }

    private static ResponseEntity<GenericResponse<?>> respond(HttpStatus status, String errorCode, String message) {
        return ResponseEntity
                .status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(GenericResponse.failure(errorCode, message));
    }
}
