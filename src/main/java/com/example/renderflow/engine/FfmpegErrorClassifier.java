package com.example.renderflow.engine;

import java.util.List;
import java.util.Locale;

/**
 * Maps ffmpeg log output of a failed run to a short hint for the job's error detail.
 */
public final class FfmpegErrorClassifier {

    public record Diagnosis(String hint, String summary, String lastErrorLine) { }

    private FfmpegErrorClassifier() {}

    public static Diagnosis classify(List<String> logLines) {
        if (logLines == null || logLines.isEmpty()) {
            return new Diagnosis("NO_OUTPUT", "Encoder failed with no output", null);
        }
        String joined = String.join("\n", logLines).toLowerCase(Locale.ROOT);
        String last = lastErrorLine(logLines);

        if (joined.contains("unknown encoder") || joined.contains("unknown codec") || joined.contains("codec not found")) {
            return new Diagnosis("INVALID_CODEC", "Requested codec not supported", last);
        }
        if (joined.contains("no such file or directory")) {
            return new Diagnosis("INPUT_MISSING", "Input file not found", last);
        }
        if (joined.contains("invalid data") || joined.contains("moov atom not found")) {
            return new Diagnosis("INPUT_CORRUPTED", "Source file is corrupted or invalid", last);
        }
        if (joined.contains("matches no streams") || joined.contains("stream specifier")) {
            return new Diagnosis("MISSING_STREAM", "An input lacks the stream the plan refers to", last);
        }
        if (joined.contains("permission denied")) {
            return new Diagnosis("PERMISSION_DENIED", "Permission denied writing output file", last);
        }
        if (joined.contains("no space left")) {
            return new Diagnosis("DISK_FULL", "Disk space exhausted", last);
        }
        if (joined.contains("cannot allocate memory") || joined.contains("out of memory")) {
            return new Diagnosis("OUT_OF_MEMORY", "Insufficient memory to encode", last);
        }
        return new Diagnosis("UNKNOWN", "Encoder processing failed", last);
    }

    static String lastErrorLine(List<String> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            String l = lines.get(i).toLowerCase(Locale.ROOT);
            if (l.contains("error") || l.contains("failed") || l.contains("invalid") || l.contains("no such file")) {
                return lines.get(i).trim();
            }
        }
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (!lines.get(i).isBlank()) return lines.get(i).trim();
        }
        return null;
    }
}
