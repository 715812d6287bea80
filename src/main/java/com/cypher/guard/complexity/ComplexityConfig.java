package com.cypher.guard.complexity;

/**
 * Configuration for {@link ComplexityAnalyzer}.
 *
 * @param enabled               whether complexity checks run at all
 * @param maxComplexityScore    score above which a query is blocked or warned about
 * @param blockOnExceed         block queries above the maximum instead of warning
 * @param maxVariablePathLength hop bound above which a variable-length path is reported
 * @param moderateThreshold     lowest score in the MODERATE band
 * @param highThreshold         lowest score in the HIGH band
 * @param criticalThreshold     lowest score in the CRITICAL band
 */
public record ComplexityConfig(
        boolean enabled,
        int maxComplexityScore,
        boolean blockOnExceed,
        int maxVariablePathLength,
        int moderateThreshold,
        int highThreshold,
        int criticalThreshold
) {
    public ComplexityConfig {
        if (maxComplexityScore <= 0) {
            maxComplexityScore = 400;
        }
        if (maxVariablePathLength <= 0) {
            maxVariablePathLength = 10;
        }
        if (moderateThreshold <= 0) {
            moderateThreshold = 100;
        }
        if (highThreshold <= 0) {
            highThreshold = 300;
        }
        if (criticalThreshold <= 0) {
            criticalThreshold = 600;
        }
        if (!(moderateThreshold < highThreshold && highThreshold < criticalThreshold)) {
            throw new IllegalArgumentException("risk thresholds must be strictly increasing: "
                    + moderateThreshold + ", " + highThreshold + ", " + criticalThreshold);
        }
    }

    /**
     * Default: enabled, blocks above 400, paths reported above 10 hops, bands at 100/300/600.
     */
    public static ComplexityConfig defaults() {
        return new ComplexityConfig(true, 400, true, 10, 100, 300, 600);
    }

    /**
     * Complexity analysis switched off.
     */
    public static ComplexityConfig disabled() {
        return new ComplexityConfig(false, 400, true, 10, 100, 300, 600);
    }

    public RiskLevel riskLevel(int score) {
        if (score >= criticalThreshold) {
            return RiskLevel.CRITICAL;
        }
        if (score >= highThreshold) {
            return RiskLevel.HIGH;
        }
        if (score >= moderateThreshold) {
            return RiskLevel.MODERATE;
        }
        return RiskLevel.SAFE;
    }

    public ComplexityConfig withMaxComplexityScore(int score) {
        return new ComplexityConfig(enabled, score, blockOnExceed, maxVariablePathLength,
                moderateThreshold, highThreshold, criticalThreshold);
    }

    public ComplexityConfig withBlockOnExceed(boolean block) {
        return new ComplexityConfig(enabled, maxComplexityScore, block, maxVariablePathLength,
                moderateThreshold, highThreshold, criticalThreshold);
    }
}
