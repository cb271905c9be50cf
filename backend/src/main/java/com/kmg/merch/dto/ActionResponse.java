package com.kmg.merch.dto;

public record ActionResponse(boolean success, String message) {
}
