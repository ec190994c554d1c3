package com.example.renderflow.dto.plan;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record OutputFormat(@NotNull @Min(16) @Max(7680) Integer width,
                           @NotNull @Min(16) @Max(7680) Integer height) {
    public static final OutputFormat DEFAULT = new OutputFormat(1080, 1920);
}
