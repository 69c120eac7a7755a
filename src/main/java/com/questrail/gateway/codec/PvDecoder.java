package com.questrail.gateway.codec;

import com.questrail.gateway.api.ProcessValue;

/**
 * PvDecoder
 * -----------------------------------------------------------------------------
 * Converts an MQTT message payload received from a client (or a bridge) into a
 * {@link ProcessValue}.
 *
 * <p>Decoding is <strong>total</strong>: no payload is ever rejected. Payloads
 * that do not follow the wire schema degrade to a plain value and, as a last
 * resort, to the payload text itself.</p>
 */
public interface PvDecoder
{
    /**
     * Decode a complete message payload.
     *
     * @param payload raw payload bytes; may be empty
     * @return the decoded value, never {@code null}
     */
    ProcessValue decode(byte[] payload);
}
