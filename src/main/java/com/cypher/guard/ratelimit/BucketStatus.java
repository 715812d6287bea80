package com.cypher.guard.ratelimit;

/**
 * Snapshot of a bucket, taken without consuming a token.
 */
public record BucketStatus(String bucket, double availableTokens, double capacity, double refillRatePerSecond) {
}
