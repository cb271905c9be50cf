package com.kmg.merch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunMode {
    LIVE,
    STUB;

    @JsonCreator
    public static RunMode fromText(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return RunMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toText() {
        return name().toLowerCase(Locale.ROOT);
    }
}
