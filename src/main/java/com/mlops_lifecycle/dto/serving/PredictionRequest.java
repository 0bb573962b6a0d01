package com.mlops_lifecycle.dto.serving;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PredictionRequest {

    // Element types are checked against the model, after the availability check
    @Schema(description = "Numeric feature vector, in the attribute order the model was trained with",
            example = "[5.1, 3.5, 1.4, 0.2]")
    private List<Object> features;
}
