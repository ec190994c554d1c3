package com.example.renderflow.dto.plan;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/** Trim window in seconds used by single-source submissions without a plan. */
public record LegacyTrim(@NotNull @PositiveOrZero Double start,
                         @NotNull @PositiveOrZero Double end) {
}
