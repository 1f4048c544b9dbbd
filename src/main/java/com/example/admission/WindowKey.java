package com.example.admission;

/** (identifier, pattern) の複合キー */
record WindowKey(String identifier, String patternKey) {}
