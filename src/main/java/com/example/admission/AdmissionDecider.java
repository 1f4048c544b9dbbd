package com.example.admission;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * 単一プロセス用のアドミッション判定。
 * WindowStore と PolicyTable はこのインスタンスだけが持ち、外からは触らせない。
 *
 * 流れ: 除外パス → identifier 解決 → ルール解決 → カウンタ判定 → (N回ごとに) 掃除
 *
 * 内部で何か例外が起きても、リクエストは通す (fail-open)。
 * レートリミッター自身が障害の原因になるのは避けたい。
 */
public class AdmissionDecider {

    private static final Logger log = LoggerFactory.getLogger(AdmissionDecider.class);

    private static final int STATUS_IDENTIFIER_CHARS = 20;

    private final PolicyTable policies;
    private final IdentifierResolver identifiers;
    private final PolicyOverride overrides;
    private final Clock clock;

    private final WindowStore store = new WindowStore();
    private final EvictionSweeper sweeper;

    private final Counter allowedCounter;
    private final Counter deniedCounter;
    private final Counter exemptCounter;
    private final Counter failedOpenCounter;

    public AdmissionDecider(PolicyTable policies,
                            IdentifierResolver identifiers,
                            PolicyOverride overrides,
                            Clock clock,
                            int sweepInterval,
                            MeterRegistry registry) {
        this.policies = policies;
        this.identifiers = identifiers;
        this.overrides = overrides;
        this.clock = clock;
        this.sweeper = new EvictionSweeper(store, policies.maxWindowSeconds(), sweepInterval, registry);

        this.allowedCounter = outcome(registry, "allowed");
        this.deniedCounter = outcome(registry, "denied");
        this.exemptCounter = outcome(registry, "exempt");
        this.failedOpenCounter = outcome(registry, "failed_open");
        Gauge.builder("ratelimiter_windows_active", store, WindowStore::size)
                .register(registry);
    }

    public Decision check(AdmissionRequest request) {
        return check(() -> request);
    }

    /**
     * リクエスト情報の取り出しも含めて判定する。取り出しで例外が起きても fail-open。
     */
    public Decision check(Supplier<AdmissionRequest> source) {
        String path = null;
        try {
            AdmissionRequest request = source.get();
            path = request.path();
            if (policies.isExempt(path)) {
                exemptCounter.increment();
                return Decision.UNLIMITED;
            }

            long now = clock.millis();
            Identifier id = identifiers.resolve(request);
            ResolvedPolicy policy = policies.resolve(path, id.authenticated(), overrides.current());

            Decision decision = store.check(id.value(), policy.patternKey(),
                    policy.limit(), policy.windowSeconds(), now);

            if (decision.allowed()) {
                allowedCounter.increment();
            } else {
                deniedCounter.increment();
            }

            sweeper.onCheck(now);
            return decision;
        } catch (RuntimeException e) {
            failedOpenCounter.increment();
            log.error("Rate limit check failed for {}, admitting request", path, e);
            return Decision.UNLIMITED;
        }
    }

    /**
     * 呼び出し元に今どのルールが効いているかを返す。カウンタは動かさない。
     */
    public RateLimitStatus describe(AdmissionRequest request) {
        Identifier id = identifiers.resolve(request);
        ResolvedPolicy policy = policies.resolve(request.path(), id.authenticated(), overrides.current());
        return new RateLimitStatus(truncate(id.value()), id.authenticated(),
                policy.limit(), policy.windowSeconds(), request.path());
    }

    /** 手動で掃除を走らせる。消した件数を返す */
    public int sweep() {
        return sweeper.sweep(clock.millis());
    }

    public int activeWindows() {
        return store.size();
    }

    public long activeIdentifiers() {
        return store.identifierCount();
    }

    WindowStore store() {
        return store;
    }

    private static String truncate(String identifier) {
        if (identifier.length() <= STATUS_IDENTIFIER_CHARS) return identifier;
        return identifier.substring(0, STATUS_IDENTIFIER_CHARS) + "...";
    }

    private static Counter outcome(MeterRegistry registry, String outcome) {
        return Counter.builder("ratelimiter_requests_total")
                .tag("outcome", outcome)
                .register(registry);
    }
}
