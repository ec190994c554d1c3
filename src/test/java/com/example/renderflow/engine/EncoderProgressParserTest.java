package com.example.renderflow.engine;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EncoderProgressParserTest {

    @Test
    void usesExpectedDurationAsDenominator() {
        EncoderProgressParser parser = new EncoderProgressParser(10_000);

        OptionalInt pct = parser.onLine("frame=  120 fps= 30 q=28.0 size=512kB time=00:00:05.00 bitrate=838.9kbits/s");

        assertEquals(OptionalInt.of(50), pct);
        assertEquals(5_000, parser.lastPositionMs());
    }

    @Test
    void fallsBackToParsedDuration() {
        EncoderProgressParser parser = new EncoderProgressParser(0);

        assertTrue(parser.onLine("  Duration: 00:00:20.00, start: 0.000000, bitrate: 1200 kb/s").isEmpty());
        assertEquals(20_000, parser.denominatorMs());
        assertEquals(OptionalInt.of(25), parser.onLine("frame=1 time=00:00:05.00 speed=1x"));
    }

    @Test
    void neverReportsLowerOrRepeatedValues() {
        EncoderProgressParser parser = new EncoderProgressParser(10_000);

        assertEquals(OptionalInt.of(40), parser.onLine("time=00:00:04.00"));
        assertTrue(parser.onLine("time=00:00:03.00").isEmpty());
        assertTrue(parser.onLine("time=00:00:04.00").isEmpty());
        assertEquals(OptionalInt.of(60), parser.onLine("time=00:00:06.00"));
    }

    @Test
    void capsRunningProgressBelowHundred() {
        EncoderProgressParser parser = new EncoderProgressParser(10_000);

        assertEquals(OptionalInt.of(EncoderProgressParser.MAX_RUNNING_PCT), parser.onLine("time=00:00:12.00"));
        assertTrue(parser.onLine("time=00:00:13.00").isEmpty());
        assertEquals(13_000, parser.lastPositionMs());
    }

    @Test
    void ignoresLinesWithoutMarkers() {
        EncoderProgressParser parser = new EncoderProgressParser(10_000);

        assertThat(parser.onLine("Stream #0:0: Video: h264")).isEmpty();
        assertThat(parser.onLine("")).isEmpty();
        assertThat(parser.onLine(null)).isEmpty();
        assertEquals(0, parser.lastPositionMs());
    }

    @Test
    void lastTimeMarkerOfALineWins() {
        EncoderProgressParser parser = new EncoderProgressParser(60_000);

        parser.onLine("time=00:00:06.00 ... time=00:00:30.00");

        assertEquals(30_000, parser.lastPositionMs());
    }
}
