package com.questrail.gateway.codec.impl;

import com.questrail.gateway.api.ProcessValue;
import com.questrail.gateway.api.PvStatus;
import com.questrail.gateway.codec.EncodingException;
import com.questrail.gateway.internal.time.FixedWallClock;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JsonPvCodecTest
 * -----------------------------------------------------------------------------
 * Wire format and decode tiers of {@link JsonPvCodec}.
 */
final class JsonPvCodecTest
{
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00.123Z");

    private final FixedWallClock clock = new FixedWallClock(NOW);
    private final JsonPvCodec codec = new JsonPvCodec(clock);

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    // ---- Encoding ----

    @Test
    void encodeProducesCompactObjectInFixedFieldOrder()
    {
        ProcessValue pv = ProcessValue.good(Instant.ofEpochMilli(1483228800000L), 123.456);

        String json = new String(codec.encode(pv), StandardCharsets.UTF_8);

        assertEquals("{\"v\":123.456,\"ts\":1483228800000,\"s\":0}", json);
    }

    @Test
    void encodeTruncatesTimestampToMilliseconds()
    {
        Instant ts = Instant.ofEpochMilli(1000L).plusNanos(999_999);
        ProcessValue pv = new ProcessValue(ts, true, PvStatus.UNCERTAIN);

        String json = new String(codec.encode(pv), StandardCharsets.UTF_8);

        assertEquals("{\"v\":true,\"ts\":1000,\"s\":100}", json);
    }

    @Test
    void encodeWritesNullAndStringValues()
    {
        assertEquals("{\"v\":null,\"ts\":5,\"s\":200}",
            new String(codec.encode(new ProcessValue(Instant.ofEpochMilli(5), null, PvStatus.BAD)),
                StandardCharsets.UTF_8));
        assertEquals("{\"v\":\"on\",\"ts\":5,\"s\":0}",
            new String(codec.encode(ProcessValue.good(Instant.ofEpochMilli(5), "on")),
                StandardCharsets.UTF_8));
    }

    @Test
    void encodeRejectsStructuredValues()
    {
        assertThrows(EncodingException.class,
            () -> codec.encode(ProcessValue.good(NOW, Map.of("a", 1))));
        assertThrows(EncodingException.class,
            () -> codec.encode(ProcessValue.good(NOW, List.of(1, 2))));
    }

    @Test
    void encodeRejectsNonFiniteNumbers()
    {
        assertThrows(EncodingException.class, () -> codec.encode(ProcessValue.good(NOW, Double.NaN)));
        assertThrows(EncodingException.class,
            () -> codec.encode(ProcessValue.good(NOW, Float.POSITIVE_INFINITY)));
    }

    @Test
    void encodedValueDecodesToSameValue()
    {
        ProcessValue original = new ProcessValue(Instant.ofEpochMilli(1700000000123L), 42.5, PvStatus.UNCERTAIN);

        ProcessValue decoded = codec.decode(codec.encode(original));

        assertEquals(original, decoded);
    }

    @Test
    void scalarValuesOfEveryTypeAndStatusRoundTripExactly()
    {
        Instant ts = Instant.ofEpochMilli(1700000000123L);
        List<Object> values = new ArrayList<>(List.of(
            Boolean.TRUE, Boolean.FALSE, "", "on", 7, 5L, Long.MAX_VALUE, (short) 3, (byte) -2,
            1.5f, 0.1f, 42.5, -0.0001, new BigInteger("123")));
        values.add(null);

        for (PvStatus status : PvStatus.values()) {
            for (Object value : values) {
                ProcessValue original = new ProcessValue(ts, value, status);

                ProcessValue decoded = codec.decode(codec.encode(original));

                assertEquals(original, decoded, "value " + value + " with status " + status);
            }
        }
    }

    @Test
    void numbersAreHeldInCanonicalForm()
    {
        assertEquals(5L, ProcessValue.good(NOW, 5).value());
        assertEquals(1.5d, ProcessValue.good(NOW, 1.5f).value());
        assertEquals(ProcessValue.good(NOW, 5L), ProcessValue.good(NOW, 5));
    }

    @Test
    void timestampOutsideEpochMillisecondRangeIsEncodingError()
    {
        assertThrows(EncodingException.class, () -> codec.encode(ProcessValue.good(Instant.MAX, 1)));
        assertThrows(EncodingException.class, () -> codec.encode(ProcessValue.good(Instant.MIN, 1)));
    }

    // ---- Tier 1: strict wire object ----

    @Test
    void strictObjectIsDecodedWithTimestampAndStatus()
    {
        ProcessValue pv = codec.decode(utf8("{\"v\":123.456,\"ts\":1483228800000,\"s\":0}"));

        assertEquals(123.456, pv.value());
        assertEquals(Instant.ofEpochMilli(1483228800000L), pv.timestamp());
        assertEquals(PvStatus.GOOD, pv.status());
    }

    @Test
    void strictObjectWithoutTimestampUsesClock()
    {
        ProcessValue pv = codec.decode(utf8("{\"v\":false}"));

        assertEquals(Boolean.FALSE, pv.value());
        assertEquals(NOW, pv.timestamp());
        assertEquals(PvStatus.GOOD, pv.status());
    }

    @Test
    void zeroTimestampUsesClock()
    {
        ProcessValue pv = codec.decode(utf8("{\"v\":1,\"ts\":0,\"s\":0}"));

        assertEquals(NOW, pv.timestamp());
        assertEquals(1L, pv.value());
    }

    @Test
    void statusCodesMapByRange()
    {
        assertEquals(PvStatus.GOOD, codec.decode(utf8("{\"v\":1,\"s\":99}")).status());
        assertEquals(PvStatus.UNCERTAIN, codec.decode(utf8("{\"v\":1,\"s\":150}")).status());
        assertEquals(PvStatus.BAD, codec.decode(utf8("{\"v\":1,\"s\":200}")).status());
        assertEquals(PvStatus.BAD, codec.decode(utf8("{\"v\":1,\"s\":-1}")).status());
    }

    // ---- Tier 2: any JSON value ----

    @Test
    void objectWithUnknownFieldFallsBackToGenericValue()
    {
        ProcessValue pv = codec.decode(utf8("{\"v\":1,\"x\":2}"));

        assertInstanceOf(Map.class, pv.value());
        assertEquals(Map.of("v", 1L, "x", 2L), pv.value());
        assertEquals(NOW, pv.timestamp());
        assertEquals(PvStatus.GOOD, pv.status());
    }

    @Test
    void floatingPointTimestampRejectsStrictTier()
    {
        ProcessValue pv = codec.decode(utf8("{\"v\":1,\"ts\":1.5}"));

        assertInstanceOf(Map.class, pv.value());
        assertEquals(NOW, pv.timestamp());
    }

    @Test
    void bareJsonScalarsAreValues()
    {
        assertEquals(42L, codec.decode(utf8("42")).value());
        assertEquals(Boolean.TRUE, codec.decode(utf8(" true ")).value());
        assertEquals("text", codec.decode(utf8("\"text\"")).value());
        assertNull(codec.decode(utf8("null")).value());
    }

    @Test
    void jsonArrayIsValue()
    {
        assertEquals(List.of(1L, 2L, 3L), codec.decode(utf8("[1,2,3]")).value());
    }

    // ---- Tier 3: raw text ----

    @Test
    void trailingContentFallsBackToRawText()
    {
        String raw = "{\"v\":1} trailing";

        ProcessValue pv = codec.decode(utf8(raw));

        assertEquals(raw, pv.value());
        assertEquals(PvStatus.GOOD, pv.status());
    }

    @Test
    void nonJsonPayloadIsRawText()
    {
        assertEquals("ON", codec.decode(utf8("ON")).value());
        assertEquals("", codec.decode(new byte[0]).value());
    }

    @Test
    void decodeNeverThrowsOnArbitraryBytes()
    {
        byte[][] payloads = {
            new byte[0],
            new byte[] { (byte) 0xFF, (byte) 0xFE, 0x00 },
            utf8("{"),
            utf8("{\"v\":"),
            utf8("]["),
            utf8("{\"ts\":\"abc\"}"),
            utf8("\u0000\u0001")
        };

        for (byte[] p : payloads) {
            ProcessValue pv = assertDoesNotThrow(() -> codec.decode(p));
            assertNotNull(pv);
            assertEquals(NOW, pv.timestamp());
        }
    }
}
