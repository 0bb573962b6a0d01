package com.mlops_lifecycle.model;

import java.util.List;

public record Prediction(
        int classIndex,
        String label,
        List<Double> probability
) {}
