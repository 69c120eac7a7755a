package com.questrail.gateway.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.questrail.gateway.api.ProcessValue;
import com.questrail.gateway.api.PvStatus;
import com.questrail.gateway.codec.EncodingException;
import com.questrail.gateway.codec.PvDecoder;
import com.questrail.gateway.codec.PvEncoder;
import com.questrail.gateway.internal.time.SystemWallClock;
import com.questrail.gateway.internal.time.WallClock;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * JsonPvCodec
 * =============================================================================
 * Jackson-backed implementation of the process value wire codec.
 *
 * <h2>Decode tiers</h2>
 * The tiers are held in an explicit, ordered list and consulted in sequence.
 * Each tier reports a {@link DecodeAttempt}; the first one that applies wins.
 * <ol>
 *   <li>Strict wire object. Unknown fields, scalar coercions, floating point
 *       {@code ts}/{@code s} and trailing content all reject the tier.</li>
 *   <li>Any JSON value, without trailing content.</li>
 *   <li>The raw payload as UTF-8 text. Always applies.</li>
 * </ol>
 *
 * <h2>Encoding</h2>
 * Only scalar values are representable. The timestamp is truncated to
 * milliseconds and must lie within the epoch millisecond range.
 *
 * <p>Integral JSON numbers decode as {@link Long}, matching the canonical
 * numeric form of {@link ProcessValue}.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class JsonPvCodec implements PvDecoder, PvEncoder
{
    private final ObjectMapper strictMapper;
    private final ObjectMapper valueMapper;
    private final ObjectMapper writer;
    private final WallClock clock;
    private final List<DecodeTier> tiers;

    public JsonPvCodec() {
        this(SystemWallClock.INSTANCE);
    }

    public JsonPvCodec(WallClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");

        this.strictMapper = JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(DeserializationFeature.USE_LONG_FOR_INTS)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .build();

        this.valueMapper = JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .enable(DeserializationFeature.USE_LONG_FOR_INTS)
                .build();

        this.writer = JsonMapper.builder().build();

        this.tiers = List.of(this::strictTier, this::valueTier, JsonPvCodec::rawTier);
    }

    @Override
    public ProcessValue decode(byte[] payload) {
        Objects.requireNonNull(payload, "payload");

        for (DecodeTier tier : tiers) {
            DecodeAttempt attempt = tier.attempt(payload);
            if (attempt.applied()) {
                return toProcessValue(attempt);
            }
        }
        // rawTier always applies
        throw new IllegalStateException("No decode tier applied");
    }

    @Override
    public byte[] encode(ProcessValue pv) {
        Objects.requireNonNull(pv, "pv");

        Object value = pv.value();
        requireScalar(value);

        WireMessage wire = new WireMessage(
                value,
                epochMillis(pv.timestamp()),
                pv.status().code()
        );
        try {
            return writer.writeValueAsBytes(wire);
        } catch (JsonProcessingException e) {
            throw new EncodingException("Conversion of PV to JSON failed: " + e.getOriginalMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Tiers
    // -------------------------------------------------------------------------

    private DecodeAttempt strictTier(byte[] payload) {
        final WireMessage wire;
        try {
            wire = strictMapper.readValue(payload, WireMessage.class);
        } catch (IOException | RuntimeException e) {
            return DecodeAttempt.notApplicable();
        }
        if (wire == null) {
            // JSON null is a value, not a wire object
            return DecodeAttempt.notApplicable();
        }
        return DecodeAttempt.wire(wire.ts(), wire.v(), wire.s());
    }

    private DecodeAttempt valueTier(byte[] payload) {
        try {
            return DecodeAttempt.valueOnly(valueMapper.readValue(payload, Object.class));
        } catch (IOException | RuntimeException e) {
            return DecodeAttempt.notApplicable();
        }
    }

    private static DecodeAttempt rawTier(byte[] payload) {
        return DecodeAttempt.valueOnly(new String(payload, StandardCharsets.UTF_8));
    }

    private ProcessValue toProcessValue(DecodeAttempt attempt) {
        Instant timestamp = attempt.timestamp() == 0L
                ? clock.now()
                : Instant.ofEpochMilli(attempt.timestamp());
        return new ProcessValue(timestamp, attempt.value(), PvStatus.fromCode(attempt.status()));
    }

    private static void requireScalar(Object value) {
        if (value == null || value instanceof Boolean || value instanceof String) {
            return;
        }
        if (value instanceof Double) {
            requireFinite((Double) value);
            return;
        }
        if (value instanceof Number) {
            return;
        }
        throw new EncodingException("Value of type " + value.getClass().getName()
                + " is not representable in the wire schema");
    }

    private static long epochMillis(Instant timestamp) {
        try {
            return timestamp.toEpochMilli();
        } catch (ArithmeticException e) {
            throw new EncodingException("Timestamp is not representable in the wire schema: " + timestamp, e);
        }
    }

    private static void requireFinite(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new EncodingException("Non-finite number is not representable in the wire schema: " + d);
        }
    }
}
