package com.kmg.merch.service;

public class JobStateException extends RuntimeException {
    public enum Reason {
        ALREADY_RUNNING("Upload already in progress"),
        NOT_RUNNING("No active upload to pause"),
        NOT_PAUSED("No paused upload to resume"),
        NO_ACTIVE_JOB("No active upload to stop");

        private final String message;

        Reason(String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    public JobStateException(Reason reason) {
        super(reason.message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
