package com.example.admission;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 使われなくなったウィンドウの掃除。
 *
 * タイマーは使わず、判定 N 回ごとに、その判定を処理しているスレッドでそのまま走らせる。
 * 残す期間は「設定中の最長 window の2倍」。ただし差し替えルールでそれより長い window を
 * 使っているエントリは、自分の window の2倍まで残す。どちらの場合も window がまだ有効な
 * エントリは残る期間内にあるので、生きているカウンタを消すことはない。
 *
 * 全件スキャンなので、アクティブな identifier が多い環境では
 * 掃除を引き当てたリクエストだけ遅くなる。同時に2本は走らせない。
 */
final class EvictionSweeper {

    private static final Logger log = LoggerFactory.getLogger(EvictionSweeper.class);

    private final WindowStore store;
    private final long retentionMillis;
    private final int interval;
    private final Counter evictedCounter;

    private final AtomicLong checks = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean();

    /**
     * @param interval 何回の判定ごとに掃除するか (0 以下で無効)
     */
    EvictionSweeper(WindowStore store, int maxWindowSeconds, int interval, MeterRegistry registry) {
        this.store = store;
        this.retentionMillis = 2L * maxWindowSeconds * 1000L;
        this.interval = interval;
        this.evictedCounter = Counter.builder("ratelimiter_evictions_total")
                .register(registry);
    }

    /** 判定1回ごとに呼ばれる。interval 回目にだけ sweep する */
    void onCheck(long nowMillis) {
        if (interval <= 0) return;
        if (checks.incrementAndGet() % interval != 0) return;
        sweep(nowMillis);
    }

    int sweep(long nowMillis) {
        if (!running.compareAndSet(false, true)) {
            // 別スレッドが掃除中
            return 0;
        }
        try {
            int removed = store.evictStale(nowMillis, retentionMillis);
            if (removed > 0) {
                evictedCounter.increment(removed);
                log.debug("Evicted {} stale rate limit windows ({} remaining)", removed, store.size());
            }
            return removed;
        } finally {
            running.set(false);
        }
    }
}
