package com.example.admission;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * パス → 上限 の対応表。起動時に一度だけ組み立て、以後は読み取り専用。
 *
 * <ul>
 *   <li>前方一致する設定のうち、いちばん長い (= 具体的な) プレフィックスを採用する</li>
 *   <li>どれにも一致しなければ default ルール</li>
 *   <li>未認証リクエストは limit に anonymousMultiplier を掛けて切り捨てる (window はそのまま)</li>
 * </ul>
 *
 * プレフィックスの重なりは検証しない。長い方が勝つだけ。
 */
public final class PolicyTable {

    private static final String API_PREFIX = "/api/";

    /** 差し替えルールのカウンタは、同じパスのグローバルのカウンタとは別に持つ */
    static final String ROUTE_KEY_PREFIX = "route:";

    private final List<PolicyRule> rules;
    private final PolicyRule defaultRule;
    private final List<String> exemptPaths;
    private final double anonymousMultiplier;
    private final int maxWindowSeconds;

    public PolicyTable(List<PolicyRule> rules, PolicyRule defaultRule,
                       List<String> exemptPaths, double anonymousMultiplier) {
        if (defaultRule == null) {
            throw new IllegalStateException("default rate limit rule must be configured");
        }
        if (!(anonymousMultiplier >= 0.0 && anonymousMultiplier <= 1.0)) {
            throw new IllegalArgumentException("anonymousMultiplier must be within [0,1]: " + anonymousMultiplier);
        }
        // 長いプレフィックスから順に見る
        this.rules = Objects.requireNonNull(rules, "rules").stream()
                .sorted(Comparator.comparingInt((PolicyRule r) -> r.pattern().length()).reversed())
                .toList();
        this.defaultRule = defaultRule;
        this.exemptPaths = List.copyOf(Objects.requireNonNull(exemptPaths, "exemptPaths"));
        this.anonymousMultiplier = anonymousMultiplier;
        this.maxWindowSeconds = this.rules.stream()
                .mapToInt(PolicyRule::windowSeconds)
                .reduce(defaultRule.windowSeconds(), Math::max);
    }

    public ResolvedPolicy resolve(String path, boolean authenticated) {
        return resolve(path, authenticated, null);
    }

    /**
     * @param override リクエストスコープで差し込まれたルール (無ければ null)。一致すれば最優先で、
     *                 カウンタのキーは "route:&lt;pattern&gt;" になる。
     */
    public ResolvedPolicy resolve(String path, boolean authenticated, PolicyRule override) {
        PolicyRule rule = null;
        String key = null;
        if (override != null && matches(override.pattern(), path)) {
            rule = override;
            key = ROUTE_KEY_PREFIX + override.pattern();
        }
        if (rule == null) {
            for (PolicyRule r : rules) {
                if (matches(r.pattern(), path)) {
                    rule = r;
                    key = r.pattern();
                    break;
                }
            }
        }
        if (rule == null) {
            rule = defaultRule;
            key = defaultPatternKey(path);
        }

        int limit = authenticated
                ? rule.maxRequests()
                : (int) Math.floor(rule.maxRequests() * anonymousMultiplier);
        return new ResolvedPolicy(key, limit, rule.windowSeconds());
    }

    public boolean isExempt(String path) {
        for (String exempt : exemptPaths) {
            if (matches(exempt, path)) return true;
        }
        return false;
    }

    /** 設定中で最も長い window (秒)。掃除の閾値に使う */
    public int maxWindowSeconds() {
        return maxWindowSeconds;
    }

    public List<PolicyRule> rules() {
        return rules;
    }

    public PolicyRule defaultRule() {
        return defaultRule;
    }

    public double anonymousMultiplier() {
        return anonymousMultiplier;
    }

    /**
     * プレフィックス一致。ただし "/" だけはルートそのものにしか一致させない
     * (素直に startsWith すると全パスが一致してしまう)。
     */
    static boolean matches(String prefix, String path) {
        if (path == null) return false;
        if ("/".equals(prefix)) return "/".equals(path);
        return path.startsWith(prefix);
    }

    /**
     * default ルールに落ちたパスのカウンタ単位。
     * "/api/xxx/..." は "/api/xxx" にまとめ、それ以外はパスそのもの。
     */
    static String defaultPatternKey(String path) {
        if (path != null && path.startsWith(API_PREFIX)) {
            int end = path.indexOf('/', API_PREFIX.length());
            String segment = (end < 0) ? path.substring(API_PREFIX.length()) : path.substring(API_PREFIX.length(), end);
            if (!segment.isEmpty()) {
                return API_PREFIX + segment;
            }
        }
        return path == null ? "" : path;
    }
}
