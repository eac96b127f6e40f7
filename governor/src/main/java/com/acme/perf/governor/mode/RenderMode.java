package com.acme.perf.governor.mode;

public enum RenderMode {
    NORMAL, LOW_POWER
}
