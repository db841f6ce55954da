package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Coarse classification of a provider failure, used for aggregation and alerting only. */
public enum ErrorSeverity {

    TRANSIENT,
    RETRYABLE,
    PERMANENT,
    UNKNOWN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
