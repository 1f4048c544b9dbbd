package com.example.admission;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyOverrideTest {

    private final PolicyOverride overrides = new PolicyOverride();
    private final PolicyRule tight = new PolicyRule("/api/search", 1, 60);

    @Test
    void ruleIsVisibleOnlyInsideTheScope() {
        assertThat(overrides.current()).isNull();

        PolicyRule seen = overrides.withOverride(tight, overrides::current);

        assertThat(seen).isEqualTo(tight);
        assertThat(overrides.current()).isNull();
    }

    @Test
    void priorStateIsRestoredEvenWhenActionThrows() {
        assertThatThrownBy(() -> overrides.withOverride(tight, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(overrides.current()).isNull();
    }

    @Test
    void nestedScopeRestoresOuterRule() {
        PolicyRule inner = new PolicyRule("/api/search/x", 2, 10);

        PolicyRule afterInner = overrides.withOverride(tight, () -> {
            overrides.withOverride(inner, () -> {
                assertThat(overrides.current()).isEqualTo(inner);
                return null;
            });
            return overrides.current();
        });

        assertThat(afterInner).isEqualTo(tight);
    }

    @Test
    void otherThreadsDoNotSeeTheOverride() throws Exception {
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> holder = CompletableFuture.runAsync(() ->
                overrides.withOverride(tight, () -> {
                    inside.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return null;
                }));

        assertThat(inside.await(5, TimeUnit.SECONDS)).isTrue();
        // 別スレッドがスコープ内にいる間も、こちらからは見えない
        assertThat(overrides.current()).isNull();

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
    }
}
