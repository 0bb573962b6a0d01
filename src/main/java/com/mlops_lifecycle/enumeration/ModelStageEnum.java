package com.mlops_lifecycle.enumeration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle stages as the model registry names them.
 */
public enum ModelStageEnum {
    NONE("None"),
    STAGING("Staging"),
    PRODUCTION("Production"),
    ARCHIVED("Archived");

    private final String registryName;

    ModelStageEnum(String registryName) {
        this.registryName = registryName;
    }

    @JsonValue
    public String getRegistryName() {
        return registryName;
    }

    @JsonCreator
    public static ModelStageEnum fromRegistryName(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return Arrays.stream(values())
                .filter(stage -> stage.registryName.equalsIgnoreCase(value) || stage.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown registry stage: " + value));
    }
}
