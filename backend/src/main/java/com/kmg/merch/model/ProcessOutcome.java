package com.kmg.merch.model;

public record ProcessOutcome(boolean ok, String error) {
    private static final ProcessOutcome OK = new ProcessOutcome(true, null);

    public static ProcessOutcome success() {
        return OK;
    }

    public static ProcessOutcome failure(String error) {
        return new ProcessOutcome(false, error == null || error.isBlank() ? "Unknown error" : error);
    }
}
