package com.kmg.merch.model;

public enum JobState {
    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    STOPPED,
    ERROR;

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }
}
