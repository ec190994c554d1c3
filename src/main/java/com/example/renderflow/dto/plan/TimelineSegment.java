package com.example.renderflow.dto.plan;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/** One cut of the master timeline; its position is its index in {@link ExecutionPlan#timeline()}. */
public record TimelineSegment(@NotBlank String assetUrl,
                              @NotNull @PositiveOrZero Long trimStartMs,
                              @NotNull @PositiveOrZero Long trimEndMs) {

    public long durationMs() {
        return trimEndMs - trimStartMs;
    }
}
