package com.example.admission;

/**
 * ルート単位の上限 (@RateLimited) に引っかかったときに投げる。
 * RateLimitExceptionHandler が 429 に変換する。
 */
public class RateLimitExceededException extends RuntimeException {

    private final transient Decision decision;

    public RateLimitExceededException(Decision decision) {
        super("Rate limit exceeded");
        this.decision = decision;
    }

    public Decision getDecision() {
        return decision;
    }

    public long getRetryAfterSeconds() {
        return Math.max(0, decision.resetSeconds());
    }
}
