package com.cypher.guard.complexity;

/**
 * Qualitative risk bands for complexity and cost scores.
 */
public enum RiskLevel {
    SAFE,
    MODERATE,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }
}
