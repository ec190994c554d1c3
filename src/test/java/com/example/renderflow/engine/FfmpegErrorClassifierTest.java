package com.example.renderflow.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class FfmpegErrorClassifierTest {

    @Test
    void emptyOutputIsNoOutput() {
        FfmpegErrorClassifier.Diagnosis d = FfmpegErrorClassifier.classify(List.of());

        assertEquals("NO_OUTPUT", d.hint());
        assertNull(d.lastErrorLine());
    }

    @Test
    void unknownEncoderIsInvalidCodec() {
        FfmpegErrorClassifier.Diagnosis d = FfmpegErrorClassifier.classify(List.of(
                "ffmpeg version 6.1",
                "Unknown encoder 'libx265x'"));

        assertEquals("INVALID_CODEC", d.hint());
    }

    @Test
    void missingInputPointsAtOffendingLine() {
        FfmpegErrorClassifier.Diagnosis d = FfmpegErrorClassifier.classify(List.of(
                "ffmpeg version 6.1",
                "/cache/a.mp4: No such file or directory",
                "Exiting normally"));

        assertEquals("INPUT_MISSING", d.hint());
        assertEquals("/cache/a.mp4: No such file or directory", d.lastErrorLine());
    }

    @Test
    void corruptedSourceIsDetected() {
        assertEquals("INPUT_CORRUPTED",
                FfmpegErrorClassifier.classify(List.of("[mov,mp4] moov atom not found")).hint());
        assertEquals("INPUT_CORRUPTED",
                FfmpegErrorClassifier.classify(List.of("/cache/a.mp4: Invalid data found when processing input")).hint());
    }

    @Test
    void permissionDiskAndMemory() {
        assertEquals("PERMISSION_DENIED", FfmpegErrorClassifier.classify(List.of("/out/x.mp4: Permission denied")).hint());
        assertEquals("DISK_FULL", FfmpegErrorClassifier.classify(List.of("av_interleaved_write_frame(): No space left on device")).hint());
        assertEquals("OUT_OF_MEMORY", FfmpegErrorClassifier.classify(List.of("Cannot allocate memory")).hint());
    }

    @Test
    void unrecognisedFailureFallsBackToLastLine() {
        FfmpegErrorClassifier.Diagnosis d = FfmpegErrorClassifier.classify(List.of("something odd", "  bye  "));

        assertEquals("UNKNOWN", d.hint());
        assertEquals("bye", d.lastErrorLine());
    }
}
