package com.kmg.merch.dto;

public record ErrorResponse(
        String error,
        String code
) {
}
