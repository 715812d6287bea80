package com.cypher.guard.ratelimit;

/**
 * Outcome of a rate limit check.
 *
 * @param allowed           whether the request is admitted
 * @param retryAfterSeconds seconds until the limiting bucket holds a token, 0 when allowed
 * @param remaining         tokens left in the most constrained bucket checked
 * @param limitedBy         name of the bucket that denied the request, {@code null} when allowed
 */
public record RateLimitDecision(boolean allowed, double retryAfterSeconds, double remaining, String limitedBy) {

    public static RateLimitDecision allowed(double remaining) {
        return new RateLimitDecision(true, 0.0, remaining, null);
    }

    public static RateLimitDecision denied(double retryAfterSeconds, double remaining, String limitedBy) {
        return new RateLimitDecision(false, retryAfterSeconds, remaining, limitedBy);
    }

    /**
     * Whole seconds to wait, rounded up, for a {@code Retry-After} style hint.
     */
    public long retryAfterWholeSeconds() {
        return (long) Math.ceil(retryAfterSeconds);
    }
}
