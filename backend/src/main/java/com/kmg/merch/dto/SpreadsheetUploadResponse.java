package com.kmg.merch.dto;

import java.util.List;

public record SpreadsheetUploadResponse(
        boolean success,
        String message,
        int count,
        List<String> imagePaths
) {
}
