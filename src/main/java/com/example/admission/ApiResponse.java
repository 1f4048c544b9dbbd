package com.example.admission;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * API 共通のレスポンス形 {success, data, error, meta}。
 */
public record ApiResponse<T>(boolean success, T data, String error, Meta meta) {

    public record Meta(@JsonProperty("request_id") String requestId,
                       @JsonProperty("retry_after") Integer retryAfter) {}

    static <T> ApiResponse<T> ok(T data, String requestId) {
        return new ApiResponse<>(true, data, null, new Meta(requestId, null));
    }

    static ApiResponse<Void> rateLimited(int retryAfter, String requestId) {
        return new ApiResponse<>(false, null, "Rate limit exceeded. Please try again later.",
                new Meta(requestId, retryAfter));
    }
}
