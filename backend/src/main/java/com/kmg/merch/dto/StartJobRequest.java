package com.kmg.merch.dto;

import com.kmg.merch.model.RunMode;
import jakarta.validation.constraints.Min;

public record StartJobRequest(
        @Min(0) Integer delaySeconds,
        RunMode mode,
        Boolean headless
) {
}
