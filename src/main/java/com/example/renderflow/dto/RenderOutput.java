package com.example.renderflow.dto;

/** Artifact of a successful render. */
public record RenderOutput(String outputPath,
                           String outputUrl,
                           long fileSizeBytes,
                           long durationMs) {
}
