package com.questrail.gateway.codec.impl;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * External representation of a process value. Built fresh for every encode and
 * decode call.
 *
 * @param v  value (boolean, number, string or null)
 * @param ts milliseconds since the Unix epoch, {@code 0} if absent
 * @param s  status code, {@code 0} if absent
 */
@JsonPropertyOrder({"v", "ts", "s"})
@JsonInclude(JsonInclude.Include.ALWAYS)
record WireMessage(Object v, long ts, int s) {
}
