package com.example.renderflow.dto.plan;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * An audio source placed on the master timeline.
 *
 * @param trimStartMs     offset into the source where playback begins
 * @param timelineStartMs where the track starts on the master timeline
 * @param timelineEndMs   where the track ends on the master timeline
 * @param volume          linear gain, 1.0 keeps the source level
 */
public record AudioTrack(@NotBlank String assetUrl,
                         @NotNull @PositiveOrZero Long trimStartMs,
                         @NotNull @PositiveOrZero Long timelineStartMs,
                         @NotNull @PositiveOrZero Long timelineEndMs,
                         @PositiveOrZero Double volume) {

    public double gain() {
        return volume != null ? volume : 1.0;
    }
}
