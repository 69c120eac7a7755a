/**
 * Process Value Wire Codec
 * =============================================================================
 *
 * <p>Maps {@link com.questrail.gateway.api.ProcessValue}s to and from MQTT
 * message payloads. The canonical payload is a JSON object:</p>
 *
 * <pre>
 *   {"v":123.456,"ts":1483228800000,"s":0}
 * </pre>
 *
 * <ul>
 *   <li>{@code v}: boolean, number, string or null</li>
 *   <li>{@code ts}: milliseconds since the Unix epoch</li>
 *   <li>{@code s}: status code, 0 = good</li>
 * </ul>
 *
 * <h2>Lenient decoding</h2>
 * Clients are not required to follow the schema. The decoder tries, in this
 * fixed order:
 *
 * <pre>
 *   payload
 *     → strict wire object (only ts, v, s; no trailing content)
 *     → any JSON value (becomes v)
 *     → raw text (becomes v)
 * </pre>
 *
 * <p>The first tier that applies cleanly wins. Decoding never fails.</p>
 */
package com.questrail.gateway.codec;
