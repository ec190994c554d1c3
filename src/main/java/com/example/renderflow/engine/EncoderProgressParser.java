package com.example.renderflow.engine;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads ffmpeg log lines and turns {@code time=} markers into a percentage.
 * <p>
 * The denominator is the expected output length when the caller knows it, otherwise the first
 * {@code Duration:} marker. Reported values never decrease and stay below 100; only the terminal
 * success write sets 100.
 */
public class EncoderProgressParser {
    private static final Pattern DURATION = Pattern.compile("Duration:\\s*(\\d+):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");
    private static final Pattern POSITION = Pattern.compile("time=\\s*(\\d+):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");
    static final int MAX_RUNNING_PCT = 99;

    private final long expectedDurationMs;
    private long parsedDurationMs;
    private long lastPositionMs;
    private int lastPct = -1;

    public EncoderProgressParser(long expectedDurationMs) {
        this.expectedDurationMs = Math.max(0L, expectedDurationMs);
    }

    /**
     * @return a new, strictly higher percentage when this line moved progress forward
     */
    public OptionalInt onLine(String line) {
        if (line == null || line.isEmpty()) {
            return OptionalInt.empty();
        }
        if (parsedDurationMs == 0L) {
            Matcher d = DURATION.matcher(line);
            if (d.find()) {
                parsedDurationMs = toMillis(d);
            }
        }
        Matcher t = POSITION.matcher(line);
        long position = -1L;
        while (t.find()) {
            position = toMillis(t);
        }
        if (position < 0) {
            return OptionalInt.empty();
        }
        lastPositionMs = Math.max(lastPositionMs, position);

        long total = denominatorMs();
        if (total <= 0) {
            return OptionalInt.empty();
        }
        int pct = (int) Math.min(MAX_RUNNING_PCT, (lastPositionMs * 100) / total);
        if (pct <= lastPct) {
            return OptionalInt.empty();
        }
        lastPct = pct;
        return OptionalInt.of(pct);
    }

    public long denominatorMs() {
        return expectedDurationMs > 0 ? expectedDurationMs : parsedDurationMs;
    }

    /** Furthest encoded position seen so far. */
    public long lastPositionMs() {
        return lastPositionMs;
    }

    public long parsedDurationMs() {
        return parsedDurationMs;
    }

    private static long toMillis(Matcher m) {
        long h = Long.parseLong(m.group(1));
        long min = Long.parseLong(m.group(2));
        double s = Double.parseDouble(m.group(3));
        return Math.round(((h * 3600) + (min * 60) + s) * 1000);
    }
}
