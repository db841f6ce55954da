package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of classifier roles in the dual-model pipeline.
 * Branching on roles is exhaustive at compile time; model identifier strings are informational only.
 */
public enum ModelRole {

    MODEL_A("model_a"),
    MODEL_B("model_b");

    private final String key;

    ModelRole(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
