package com.mlops_lifecycle.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelSourceEnum {
    REGISTRY,
    LOCAL,
    NONE;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase();
    }
}
