package com.example.admission;

/**
 * PolicyTable がリクエストごとに決めた実効値。
 * limit は匿名倍率を掛けたあとの値なので 0 になることもある。
 */
public record ResolvedPolicy(String patternKey, int limit, int windowSeconds) {}
