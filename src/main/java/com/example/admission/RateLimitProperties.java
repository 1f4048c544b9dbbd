package com.example.admission;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * アプリ全体のレートリミッター設定値。
 *
 * endpoints:
 *   パスプレフィックスごとの上限。一致しないパスは defaultRule。
 *
 * anonymousMultiplier:
 *   未認証リクエストの上限に掛ける倍率 (0〜1)。0.5 なら認証済みの半分。
 */
@ConfigurationProperties(prefix = "ratelimit")
public class RateLimitProperties {

    /** false にするとフィルタ自体を登録しない */
    private boolean enabled = true;

    /** どの endpoints にも一致しないときのルール */
    private Rule defaultRule = new Rule(1000, 3600);

    private List<Endpoint> endpoints = new ArrayList<>(List.of(
            new Endpoint("/api/search", 100, 60),
            new Endpoint("/api/ingestion", 50, 60),
            new Endpoint("/api/documents/upload", 20, 60),
            new Endpoint("/api/voice", 30, 60),
            new Endpoint("/api/youtube", 60, 60),
            new Endpoint("/api/graph", 100, 60)
    ));

    /** 制限しないパス。"/" はルートのみ */
    private List<String> exemptPaths = new ArrayList<>(List.of(
            "/api/health",
            "/api/crons/health",
            "/api/migrations/health",
            "/api/webhooks",
            "/docs",
            "/redoc",
            "/openapi.json",
            "/"
    ));

    private double anonymousMultiplier = 0.5;

    /** X-RateLimit-* ヘッダを付けるか (429 の Retry-After は常に付ける) */
    private boolean includeHeaders = true;

    /** 何回の判定ごとに掃除するか (0で無効) */
    private int sweepInterval = 1000;

    /** 接続元アドレスとして信じるプロキシヘッダ */
    private String forwardedHeader = "X-Forwarded-For";

    /** 信頼できるプロキシの後ろにいないなら false にする */
    private boolean trustForwardedHeader = true;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Rule getDefaultRule() { return defaultRule; }
    public void setDefaultRule(Rule defaultRule) { this.defaultRule = defaultRule; }

    public List<Endpoint> getEndpoints() { return endpoints; }
    public void setEndpoints(List<Endpoint> endpoints) { this.endpoints = endpoints; }

    public List<String> getExemptPaths() { return exemptPaths; }
    public void setExemptPaths(List<String> exemptPaths) { this.exemptPaths = exemptPaths; }

    public double getAnonymousMultiplier() { return anonymousMultiplier; }
    public void setAnonymousMultiplier(double anonymousMultiplier) { this.anonymousMultiplier = anonymousMultiplier; }

    public boolean isIncludeHeaders() { return includeHeaders; }
    public void setIncludeHeaders(boolean includeHeaders) { this.includeHeaders = includeHeaders; }

    public int getSweepInterval() { return sweepInterval; }
    public void setSweepInterval(int sweepInterval) { this.sweepInterval = sweepInterval; }

    public String getForwardedHeader() { return forwardedHeader; }
    public void setForwardedHeader(String forwardedHeader) { this.forwardedHeader = forwardedHeader; }

    public boolean isTrustForwardedHeader() { return trustForwardedHeader; }
    public void setTrustForwardedHeader(boolean trustForwardedHeader) { this.trustForwardedHeader = trustForwardedHeader; }

    /** 設定値から PolicyTable を組み立てる。不正な値はここで例外 (= 起動失敗) */
    PolicyTable toPolicyTable() {
        if (defaultRule == null) {
            throw new IllegalStateException("ratelimit.default-rule must be configured");
        }
        List<PolicyRule> rules = endpoints.stream()
                .map(e -> new PolicyRule(e.getPattern(), e.getRequests(), e.getWindowSeconds()))
                .toList();
        PolicyRule fallback = new PolicyRule("*", defaultRule.getRequests(), defaultRule.getWindowSeconds());
        return new PolicyTable(rules, fallback, exemptPaths, anonymousMultiplier);
    }

    public static class Rule {
        private int requests;
        private int windowSeconds;

        public Rule() {}

        public Rule(int requests, int windowSeconds) {
            this.requests = requests;
            this.windowSeconds = windowSeconds;
        }

        public int getRequests() { return requests; }
        public void setRequests(int requests) { this.requests = requests; }

        public int getWindowSeconds() { return windowSeconds; }
        public void setWindowSeconds(int windowSeconds) { this.windowSeconds = windowSeconds; }
    }

    public static class Endpoint extends Rule {
        private String pattern;

        public Endpoint() {}

        public Endpoint(String pattern, int requests, int windowSeconds) {
            super(requests, windowSeconds);
            this.pattern = pattern;
        }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
    }
}
