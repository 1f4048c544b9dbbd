package com.example.admission;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 呼び出し元向けの現在の制限内容。identifier はプライバシーのため先頭だけ。
 */
public record RateLimitStatus(String identifier,
                              @JsonProperty("is_authenticated") boolean authenticated,
                              int limit,
                              @JsonProperty("window_seconds") int windowSeconds,
                              String path) {}
