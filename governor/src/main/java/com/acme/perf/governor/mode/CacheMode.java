package com.acme.perf.governor.mode;

public enum CacheMode {
    NORMAL, AGGRESSIVE
}
