package com.entityradar.domain;

/**
 * Risk label bands.
 */
public enum RiskLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static RiskLevel of(double score) {
        if (score >= 0.65) {
            return HIGH;
        }
        if (score >= 0.35) {
            return MEDIUM;
        }
        return LOW;
    }
}
