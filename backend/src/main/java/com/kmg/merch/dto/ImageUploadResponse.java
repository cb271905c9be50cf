package com.kmg.merch.dto;

public record ImageUploadResponse(
        boolean success,
        String message,
        String path
) {
}
