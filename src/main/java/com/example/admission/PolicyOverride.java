package com.example.admission;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 特定の呼び出しだけ上限を差し替えるためのスコープ。
 *
 * 共有の PolicyTable は書き換えず、差し替えルールは現在のスレッド (= 処理中のリクエスト)
 * にだけ見える。なので同じパターンに同時に来た別リクエストには影響しない。
 * action が例外を投げても、抜けるときに必ず元の状態 (入れ子なら外側のルール) に戻す。
 */
public final class PolicyOverride {

    private final ThreadLocal<PolicyRule> current = new ThreadLocal<>();

    public <T> T withOverride(PolicyRule rule, Supplier<T> action) {
        Objects.requireNonNull(rule, "rule");
        PolicyRule previous = current.get();
        current.set(rule);
        try {
            return action.get();
        } finally {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        }
    }

    /** 今のスレッドで有効な差し替えルール。無ければ null */
    PolicyRule current() {
        return current.get();
    }
}
