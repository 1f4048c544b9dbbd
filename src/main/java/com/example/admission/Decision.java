package com.example.admission;

/**
 * 1リクエスト分の判定結果。
 *
 * limit / remaining / resetSeconds が -1 のものは「制限対象外」の番兵値で、
 * このときは X-RateLimit-* ヘッダを付けない。
 */
public record Decision(boolean allowed, int remaining, int limit, int resetSeconds) {

    /** 除外パス・フェイルオープン時に返す番兵 */
    public static final Decision UNLIMITED = new Decision(true, -1, -1, -1);

    static Decision permit(int remaining, int limit, int resetSeconds) {
        return new Decision(true, remaining, limit, resetSeconds);
    }

    static Decision reject(int limit, int resetSeconds) {
        return new Decision(false, 0, limit, resetSeconds);
    }

    /** ヘッダを付けるべき有限の上限があるか */
    public boolean hasLimit() {
        return limit >= 0;
    }
}
