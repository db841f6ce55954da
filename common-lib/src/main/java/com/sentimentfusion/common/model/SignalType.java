package com.sentimentfusion.common.model;

public enum SignalType {
    AGREEMENT,
    PARTIAL_AGREEMENT,
    DISAGREEMENT,
    ERROR
}
