package com.example.renderflow.dto.plan;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Declarative description of a render. Segment order in {@code timeline} is the final sequence.
 */
public record ExecutionPlan(@NotEmpty List<@Valid TimelineSegment> timeline,
                            List<@Valid AudioTrack> audioTracks,
                            List<@Valid TextOverlay> textOverlays,
                            @NotNull @Valid OutputFormat outputFormat) {

    public List<AudioTrack> audioTracksOrEmpty() {
        return audioTracks == null ? List.of() : audioTracks;
    }

    public List<TextOverlay> textOverlaysOrEmpty() {
        return textOverlays == null ? List.of() : textOverlays;
    }

    /** Sum of all segment windows, i.e. the length of the concatenated video track. */
    public long expectedDurationMs() {
        if (timeline == null) {
            return 0L;
        }
        long total = 0L;
        for (TimelineSegment segment : timeline) {
            if (segment != null && segment.trimStartMs() != null && segment.trimEndMs() != null) {
                total += Math.max(0L, segment.durationMs());
            }
        }
        return total;
    }
}
