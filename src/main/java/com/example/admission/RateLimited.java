package com.example.admission;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 特定のハンドラだけ上限を絞る。
 *
 * <pre>
 * &#64;RateLimited(requests = 10, windowSeconds = 60)
 * &#64;GetMapping("/api/reports/export")
 * public ... export() { ... }
 * </pre>
 *
 * グローバル設定は書き換えない。カウンタはリクエストパス (pattern 指定時はそれ) ごとに別管理。
 * 未認証リクエストには通常どおり匿名倍率が掛かる。
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RateLimited {

    int requests() default 100;

    int windowSeconds() default 60;

    /** 空ならリクエストパスをそのままパターンにする */
    String pattern() default "";
}
