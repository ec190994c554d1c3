package com.example.renderflow.engine;

import com.example.renderflow.dto.plan.AudioTrack;
import com.example.renderflow.dto.plan.ExecutionPlan;
import com.example.renderflow.dto.plan.OutputFormat;
import com.example.renderflow.dto.plan.TextOverlay;
import com.example.renderflow.dto.plan.TimelineSegment;
import com.example.renderflow.exception.PlanValidationException;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates an {@link ExecutionPlan} into a single ffmpeg invocation with one filtergraph:
 * per-segment trim/scale/pad chains, a video-only concat, time-gated drawtext overlays and an
 * amix of the placed audio tracks.
 * <p>
 * No I/O happens here; the same plan and path mapping always yield the same arguments.
 */
public class PlanCompiler {

    static final String MAIN_VIDEO_TAG = "[main_v]";
    static final String MIXED_AUDIO_TAG = "[mixed_a]";

    private static final String DEFAULT_FONT_COLOR = "white";
    private static final int DEFAULT_FONT_SIZE = 48;
    private static final String DEFAULT_X = "(w-text_w)/2";
    private static final String DEFAULT_Y = "(h-text_h)/2";
    private static final String DEFAULT_BOX_COLOR = "black@0.5";

    private final String ffmpegBin;
    private final String videoCodec;
    private final String preset;
    private final String audioCodec;
    private final String audioBitrate;

    public PlanCompiler(String ffmpegBin, String videoCodec, String preset, String audioCodec, String audioBitrate) {
        this.ffmpegBin = ffmpegBin;
        this.videoCodec = videoCodec;
        this.preset = preset;
        this.audioCodec = audioCodec;
        this.audioBitrate = audioBitrate;
    }

    public EncoderCommand compile(ExecutionPlan plan, Map<String, Path> localPaths, Path outputPath) {
        validate(plan);
        if (outputPath == null) {
            throw new PlanValidationException("Output path is required");
        }

        OutputFormat format = plan.outputFormat();
        int w = format.width();
        int h = format.height();

        Map<Path, Integer> inputIndex = new LinkedHashMap<>();
        List<String> filters = new ArrayList<>();

        // 1) timeline segments -> [v0]..[vN]
        StringBuilder concatInputs = new StringBuilder();
        List<TimelineSegment> timeline = plan.timeline();
        for (int i = 0; i < timeline.size(); i++) {
            TimelineSegment segment = timeline.get(i);
            int idx = indexOf(inputIndex, resolveLocal(localPaths, segment.assetUrl()));
            String tag = "[v" + i + "]";
            filters.add("[" + idx + ":v]"
                    + "trim=start=" + seconds(segment.trimStartMs()) + ":end=" + seconds(segment.trimEndMs())
                    + ",setpts=PTS-STARTPTS"
                    + ",scale=" + w + ":" + h + ":force_original_aspect_ratio=decrease"
                    + ",pad=" + w + ":" + h + ":(ow-iw)/2:(oh-ih)/2"
                    + ",setsar=1"
                    + tag);
            concatInputs.append(tag);
        }

        // 2) video-only concat, order of the timeline is the final sequence
        filters.add(concatInputs + "concat=n=" + timeline.size() + ":v=1:a=0" + MAIN_VIDEO_TAG);
        String videoTag = MAIN_VIDEO_TAG;

        // 3) overlays compose on top of each other
        List<TextOverlay> overlays = plan.textOverlaysOrEmpty();
        for (int i = 0; i < overlays.size(); i++) {
            String next = "[v_txt_" + i + "]";
            filters.add(videoTag + drawText(overlays.get(i)) + next);
            videoTag = next;
        }

        // 4) audio tracks -> [mixed_a]
        List<AudioTrack> tracks = plan.audioTracksOrEmpty();
        String audioTag = null;
        if (!tracks.isEmpty()) {
            StringBuilder mixInputs = new StringBuilder();
            for (int i = 0; i < tracks.size(); i++) {
                AudioTrack track = tracks.get(i);
                int idx = indexOf(inputIndex, resolveLocal(localPaths, track.assetUrl()));
                long placedMs = track.timelineEndMs() - track.timelineStartMs();
                long delayMs = track.timelineStartMs();
                String tag = "[a_track_" + i + "]";
                filters.add("[" + idx + ":a]"
                        + "atrim=start=" + seconds(track.trimStartMs()) + ":duration=" + seconds(placedMs)
                        + ",asetpts=PTS-STARTPTS"
                        + ",adelay=" + delayMs + "|" + delayMs
                        + ",volume=" + decimal(track.gain())
                        + tag);
                mixInputs.append(tag);
            }
            filters.add(mixInputs + "amix=inputs=" + tracks.size() + ":duration=longest" + MIXED_AUDIO_TAG);
            audioTag = MIXED_AUDIO_TAG;
        }

        List<String> args = new ArrayList<>();
        args.add("-y");
        for (Path input : inputIndex.keySet()) {
            args.add("-i");
            args.add(input.toString());
        }
        args.add("-filter_complex");
        args.add(String.join(";", filters));
        args.add("-map");
        args.add(videoTag);
        if (audioTag != null) {
            args.add("-map");
            args.add(audioTag);
            args.add("-c:a");
            args.add(audioCodec);
            args.add("-b:a");
            args.add(audioBitrate);
        }
        args.add("-c:v");
        args.add(videoCodec);
        args.add("-preset");
        args.add(preset);
        args.add("-pix_fmt");
        args.add("yuv420p");
        args.add("-movflags");
        args.add("+faststart");
        args.add(outputPath.toString());

        return new EncoderCommand(ffmpegBin, args);
    }

    /**
     * Structural checks that must pass before anything is downloaded or spawned.
     *
     * @throws PlanValidationException on the first problem found
     */
    public void validate(ExecutionPlan plan) {
        if (plan == null) {
            throw new PlanValidationException("Execution plan is missing");
        }
        if (plan.timeline() == null || plan.timeline().isEmpty()) {
            throw new PlanValidationException("Timeline is empty, nothing to render");
        }
        OutputFormat format = plan.outputFormat();
        if (format == null || format.width() == null || format.height() == null
                || format.width() <= 0 || format.height() <= 0) {
            throw new PlanValidationException("Output format needs positive width and height");
        }
        for (int i = 0; i < plan.timeline().size(); i++) {
            TimelineSegment s = plan.timeline().get(i);
            if (s == null || isBlank(s.assetUrl())) {
                throw new PlanValidationException("Segment " + i + " has no asset");
            }
            requireWindow("Segment " + i + " trim", s.trimStartMs(), s.trimEndMs());
        }
        List<AudioTrack> tracks = plan.audioTracksOrEmpty();
        for (int i = 0; i < tracks.size(); i++) {
            AudioTrack t = tracks.get(i);
            if (t == null || isBlank(t.assetUrl())) {
                throw new PlanValidationException("Audio track " + i + " has no asset");
            }
            if (t.trimStartMs() == null || t.trimStartMs() < 0) {
                throw new PlanValidationException("Audio track " + i + " trim start must be >= 0");
            }
            requireWindow("Audio track " + i + " placement", t.timelineStartMs(), t.timelineEndMs());
            if (t.gain() < 0) {
                throw new PlanValidationException("Audio track " + i + " volume must be >= 0");
            }
        }
        List<TextOverlay> overlays = plan.textOverlaysOrEmpty();
        for (int i = 0; i < overlays.size(); i++) {
            TextOverlay o = overlays.get(i);
            if (o == null || isBlank(o.content())) {
                throw new PlanValidationException("Text overlay " + i + " has no text");
            }
            requireWindow("Text overlay " + i + " window", o.timelineStartMs(), o.timelineEndMs());
        }
    }

    private static void requireWindow(String what, Long startMs, Long endMs) {
        if (startMs == null || endMs == null) {
            throw new PlanValidationException(what + " window is incomplete");
        }
        if (startMs < 0) {
            throw new PlanValidationException(what + " start must be >= 0, got " + startMs);
        }
        if (endMs <= startMs) {
            throw new PlanValidationException(what + " end (" + endMs + "ms) must be after start (" + startMs + "ms)");
        }
    }

    private static Path resolveLocal(Map<String, Path> localPaths, String assetUrl) {
        Path local = localPaths == null ? null : localPaths.get(assetUrl);
        if (local == null) {
            throw new PlanValidationException("Asset was not fetched locally: " + assetUrl);
        }
        String raw = local.toString().toLowerCase(Locale.ROOT);
        if (raw.startsWith("http:") || raw.startsWith("https:")) {
            throw new PlanValidationException("Remote input not allowed: " + local);
        }
        return local;
    }

    private static int indexOf(Map<Path, Integer> inputIndex, Path path) {
        Integer idx = inputIndex.get(path);
        if (idx == null) {
            idx = inputIndex.size();
            inputIndex.put(path, idx);
        }
        return idx;
    }

    private static String drawText(TextOverlay overlay) {
        StringBuilder sb = new StringBuilder("drawtext=");
        if (!isBlank(overlay.fontFile())) {
            sb.append("fontfile='").append(escapeFilterValue(overlay.fontFile())).append("':");
        }
        sb.append("text='").append(escapeFilterValue(overlay.content())).append("':");
        sb.append("fontsize=").append(overlay.fontSize() != null ? overlay.fontSize() : DEFAULT_FONT_SIZE).append(':');
        sb.append("fontcolor=").append(isBlank(overlay.color()) ? DEFAULT_FONT_COLOR : overlay.color()).append(':');
        sb.append("x=").append(isBlank(overlay.x()) ? DEFAULT_X : overlay.x()).append(':');
        sb.append("y=").append(isBlank(overlay.y()) ? DEFAULT_Y : overlay.y()).append(':');
        if (Boolean.TRUE.equals(overlay.box())) {
            sb.append("box=1:boxcolor=")
                    .append(isBlank(overlay.boxColor()) ? DEFAULT_BOX_COLOR : overlay.boxColor())
                    .append(":boxborderw=5:");
        }
        sb.append("enable='between(t,")
                .append(seconds(overlay.timelineStartMs())).append(',')
                .append(seconds(overlay.timelineEndMs())).append(")'");
        return sb.toString();
    }

    /** Escape for a single-quoted drawtext option value inside a filtergraph. */
    static String escapeFilterValue(String value) {
        return value
                .replace("\\", "\\\\")
                .replace("'", "'\\''")
                .replace(":", "\\:")
                .replace("%", "\\%");
    }

    static String seconds(long ms) {
        return BigDecimal.valueOf(ms, 3).stripTrailingZeros().toPlainString();
    }

    private static String decimal(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
