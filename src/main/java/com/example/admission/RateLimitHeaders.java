package com.example.admission;

import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;

/**
 * Decision をレスポンスヘッダにする。番兵 (limit=-1) のときは何も付けない。
 */
final class RateLimitHeaders {

    static final String LIMIT = "X-RateLimit-Limit";
    static final String REMAINING = "X-RateLimit-Remaining";
    static final String RESET = "X-RateLimit-Reset";
    static final String REQUEST_ID = "X-Request-ID";

    private RateLimitHeaders() {}

    static void apply(HttpServletResponse response, Decision decision) {
        if (!decision.hasLimit()) return;
        response.setHeader(LIMIT, String.valueOf(decision.limit()));
        response.setHeader(REMAINING, String.valueOf(decision.remaining()));
        response.setHeader(RESET, String.valueOf(decision.resetSeconds()));
    }

    /**
     * 429 用。Retry-After は includeRateLimitHeaders に関係なく付ける。
     * setHeader なので、フィルタが先に付けた値があっても上書きされる。
     */
    static void applyTooManyRequests(HttpServletResponse response, Decision decision, boolean includeRateLimitHeaders) {
        if (includeRateLimitHeaders && decision.hasLimit()) {
            response.setHeader(LIMIT, String.valueOf(decision.limit()));
            response.setHeader(REMAINING, "0");
            response.setHeader(RESET, String.valueOf(decision.resetSeconds()));
        }
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(0, decision.resetSeconds())));
    }
}
