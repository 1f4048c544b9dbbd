package com.example.admission;

/**
 * カウンタを紐付けるキー。"user:&lt;id&gt;" か "ip:&lt;hash&gt;" のどちらか。
 */
public record Identifier(String value, boolean authenticated) {

    static final Identifier UNKNOWN = new Identifier("ip:unknown", false);

    static Identifier user(String principalId) {
        return new Identifier("user:" + principalId, true);
    }

    static Identifier ip(String digest) {
        return new Identifier("ip:" + digest, false);
    }
}
