package com.kmg.merch.model;

import java.time.Duration;
import java.util.Objects;

public record JobOptions(Duration delay, RunMode mode, boolean headless) {
    public JobOptions {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(mode, "mode");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
    }
}
