package com.example.renderflow.dto.plan;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Burned-in text shown between {@code timelineStartMs} and {@code timelineEndMs}.
 * {@code x} and {@code y} are drawtext expressions, e.g. {@code (w-text_w)/2}.
 */
public record TextOverlay(@NotBlank String content,
                          @NotNull @PositiveOrZero Long timelineStartMs,
                          @NotNull @PositiveOrZero Long timelineEndMs,
                          String x,
                          String y,
                          @Positive Integer fontSize,
                          String color,
                          String fontFile,
                          Boolean box,
                          String boxColor) {
}
