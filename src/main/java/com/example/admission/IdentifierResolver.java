package com.example.admission;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * リクエストから「誰のカウンタか」を決める。
 *
 * 1) 認証済み principal があれば user:&lt;id&gt;
 * 2) なければ接続元 IP を SHA-256 して先頭16桁だけ使う ip:&lt;hash&gt; (生の IP は保持しない)
 * 3) IP も取れなければ ip:unknown
 *
 * プロキシヘッダは先頭の1エントリだけを信じる。経路の検証はしないので、
 * 信頼できるプロキシの後ろでしか trustForwardedFor を有効にしないこと。
 */
public class IdentifierResolver {

    static final int DIGEST_LENGTH = 16;

    private final boolean trustForwardedFor;

    public IdentifierResolver(boolean trustForwardedFor) {
        this.trustForwardedFor = trustForwardedFor;
    }

    public Identifier resolve(AdmissionRequest request) {
        String principal = request.principalId();
        if (principal != null && !principal.isBlank()) {
            return Identifier.user(principal.trim());
        }

        String address = effectiveAddress(request);
        if (address == null) {
            return Identifier.UNKNOWN;
        }
        return Identifier.ip(digest(address));
    }

    private String effectiveAddress(AdmissionRequest request) {
        if (trustForwardedFor) {
            String xff = request.forwardedFor();
            if (xff != null && !xff.isBlank()) {
                // "client, proxy1, proxy2" の先頭
                int comma = xff.indexOf(',');
                String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
                if (!first.isEmpty()) return first;
            }
        }
        String remote = request.remoteAddress();
        return (remote == null || remote.isBlank()) ? null : remote.trim();
    }

    static String digest(String address) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(address.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, DIGEST_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
