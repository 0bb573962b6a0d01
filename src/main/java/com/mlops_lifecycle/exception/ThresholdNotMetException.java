package com.mlops_lifecycle.exception;

import lombok.Getter;

/**
 * The staging model did not reach the configured accuracy. Expected outcome, not a bug:
 * the promotion job exits non-zero so that orchestration halts the deploy.
 */
@Getter
public class ThresholdNotMetException extends RuntimeException {

    private final double accuracy;
    private final double threshold;

    public ThresholdNotMetException(double accuracy, double threshold) {
        super(String.format("Model accuracy %.4f is below threshold %.4f", accuracy, threshold));
        this.accuracy = accuracy;
        this.threshold = threshold;
    }
}
