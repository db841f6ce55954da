package com.sentimentfusion.common.model;

public enum SignalStrength {
    STRONG,
    MODERATE,
    WEAK,
    FAILED
}
