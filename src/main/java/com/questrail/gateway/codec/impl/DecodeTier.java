package com.questrail.gateway.codec.impl;

/**
 * One step of the lenient decode strategy.
 */
@FunctionalInterface
interface DecodeTier
{
    DecodeAttempt attempt(byte[] payload);
}
