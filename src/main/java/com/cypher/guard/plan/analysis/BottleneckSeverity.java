package com.cypher.guard.plan.analysis;

/**
 * Severity of a plan bottleneck, lowest first.
 */
public enum BottleneckSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
