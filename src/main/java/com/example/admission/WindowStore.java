package com.example.admission;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * (identifier, pattern) → WindowState を持つプロセス内ストア。
 *
 * 同じキーへの read-modify-write は ConcurrentHashMap#compute の中で行うので、
 * 同時に来たリクエスト同士で更新が消える (= 上限を超えて通す) ことはない。
 * 掃除側の削除も computeIfPresent で同じキーの判定と直列化される。
 */
final class WindowStore {

    private final Map<WindowKey, WindowState> windows = new ConcurrentHashMap<>();

    Decision check(String identifier, String patternKey, int limit, int windowSeconds, long nowMillis) {
        WindowKey key = new WindowKey(identifier, patternKey);
        Decision[] result = new Decision[1];
        windows.compute(key, (k, state) -> {
            WindowState s = (state != null) ? state : new WindowState(nowMillis);
            result[0] = s.admit(limit, windowSeconds, nowMillis);
            return s;
        });
        return result[0];
    }

    /**
     * 古くなったエントリを消す。判定は WindowState#isStale。
     *
     * @return 消した件数
     */
    int evictStale(long nowMillis, long minRetentionMillis) {
        int[] removed = {0};
        for (WindowKey key : windows.keySet()) {
            windows.computeIfPresent(key, (k, state) -> {
                if (state.isStale(nowMillis, minRetentionMillis)) {
                    removed[0]++;
                    return null;
                }
                return state;
            });
        }
        return removed[0];
    }

    Optional<WindowState> find(String identifier, String patternKey) {
        return Optional.ofNullable(windows.get(new WindowKey(identifier, patternKey)));
    }

    int size() {
        return windows.size();
    }

    long identifierCount() {
        return windows.keySet().stream().map(WindowKey::identifier).distinct().count();
    }
}
