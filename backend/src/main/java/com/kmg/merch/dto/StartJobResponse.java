package com.kmg.merch.dto;

public record StartJobResponse(
        boolean success,
        String message,
        String runId
) {
}
