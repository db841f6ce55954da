package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgreementType {

    FULL_AGREEMENT,
    PARTIAL_AGREEMENT,
    DISAGREEMENT,
    ERROR;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
