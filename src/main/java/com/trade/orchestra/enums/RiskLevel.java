package com.trade.orchestra.enums;

/**
 * Discrete portfolio risk levels, also used as warning severity.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Map a composite risk score [0–100] to a RiskLevel.
     *
     * @param score weighted risk score (0 = no risk, 100 = maximum risk)
     * @return LOW below 40, MEDIUM below 60, HIGH below 80, CRITICAL otherwise
     */
    public static RiskLevel fromScore(double score) {
        if (score >= 80) {
            return CRITICAL;
        } else if (score >= 60) {
            return HIGH;
        } else if (score >= 40) {
            return MEDIUM;
        } else {
            return LOW;
        }
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }
}
