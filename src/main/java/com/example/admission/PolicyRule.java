package com.example.admission;

import java.util.Objects;

/**
 * パスプレフィックスごとの上限設定。
 * pattern に前方一致したリクエストは windowSeconds 秒あたり maxRequests 回まで通す。
 */
public record PolicyRule(String pattern, int maxRequests, int windowSeconds) {

    public PolicyRule {
        Objects.requireNonNull(pattern, "pattern");
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1: " + pattern + "=" + maxRequests);
        }
        if (windowSeconds < 1) {
            throw new IllegalArgumentException("windowSeconds must be >= 1: " + pattern + "=" + windowSeconds);
        }
    }
}
