package com.example.admission;

/**
 * 固定ウィンドウのカウンタ（スレッドセーフ）。
 *
 * count: 今のウィンドウで通したリクエスト数
 * windowStartMillis: 今のウィンドウの開始時刻
 *
 * 固定ウィンドウなので、境界の直前と直後に詰めて叩かれると
 * 短時間に最大で約2倍 (limit × 2) まで通ってしまう。
 * その代わり1回の判定は O(1) で、保持するのは数値2つだけ。
 */
final class WindowState {

    private int count;
    private long windowStartMillis;
    // 直近の判定で使った window。差し替えルールは設定の最長 window より長いことがある
    private int windowSeconds;

    WindowState(long nowMillis) {
        this.windowStartMillis = nowMillis;
    }

    /**
     * 1回分の通過を試みる。拒否したときは count を増やさない。
     */
    synchronized Decision admit(int limit, int windowSeconds, long nowMillis) {
        this.windowSeconds = windowSeconds;
        long windowMillis = windowSeconds * 1000L;

        // ウィンドウが終わっていればリセット
        if (nowMillis >= windowStartMillis + windowMillis) {
            count = 0;
            windowStartMillis = nowMillis;
        }

        int resetSeconds = secondsUntilReset(windowMillis, nowMillis);

        if (count >= limit) {
            return Decision.reject(limit, resetSeconds);
        }

        count++;
        return Decision.permit(Math.max(0, limit - count), limit, resetSeconds);
    }

    /**
     * 掃除してよいか。残す期間は minRetentionMillis と「自分の window の2倍」の長い方。
     */
    synchronized boolean isStale(long nowMillis, long minRetentionMillis) {
        long retention = Math.max(minRetentionMillis, 2L * windowSeconds * 1000L);
        return windowStartMillis < nowMillis - retention;
    }

    synchronized int count() {
        return count;
    }

    synchronized long windowStartMillis() {
        return windowStartMillis;
    }

    // 秒単位に切り上げ (残り 0.3 秒でも Retry-After は 1)
    private int secondsUntilReset(long windowMillis, long nowMillis) {
        long ms = windowStartMillis + windowMillis - nowMillis;
        if (ms <= 0) return 0;
        return (int) ((ms + 999) / 1000);
    }
}
