package com.questrail.gateway.codec;

import com.questrail.gateway.api.ProcessValue;

/**
 * PvEncoder
 * -----------------------------------------------------------------------------
 * Converts a {@link ProcessValue} into the wire schema
 * {@code {"v":..., "ts":..., "s":...}}.
 */
public interface PvEncoder
{
    /**
     * @param pv value to encode
     * @return UTF-8 JSON payload
     * @throws EncodingException if the value cannot be expressed in the schema
     */
    byte[] encode(ProcessValue pv);
}
