package com.questrail.gateway.broker.internal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TopicNamesTest
{
    @Test
    void validNames()
    {
        assertNull(TopicNames.validateName("device/status/ABC123/1/LEVEL"));
        assertNull(TopicNames.validateName("/leading/slash"));
        assertNull(TopicNames.validateName("a//b"));
    }

    @Test
    void invalidNames()
    {
        assertNotNull(TopicNames.validateName(""));
        assertNotNull(TopicNames.validateName(null));
        assertNotNull(TopicNames.validateName("a/+/b"));
        assertNotNull(TopicNames.validateName("a/#"));
        assertNotNull(TopicNames.validateName("a\u0000b"));
        assertNotNull(TopicNames.validateName("x".repeat(TopicNames.MAX_LENGTH + 1)));
    }

    @Test
    void validFilters()
    {
        assertNull(TopicNames.validateFilter("#"));
        assertNull(TopicNames.validateFilter("+"));
        assertNull(TopicNames.validateFilter("device/+/ABC/+/LEVEL"));
        assertNull(TopicNames.validateFilter("device/set/#"));
    }

    @Test
    void invalidFilters()
    {
        assertNotNull(TopicNames.validateFilter("device/#/LEVEL"));
        assertNotNull(TopicNames.validateFilter("device/set#"));
        assertNotNull(TopicNames.validateFilter("device/se+/x"));
        assertNotNull(TopicNames.validateFilter(""));
    }

    @Test
    void wildcardMatching()
    {
        assertTrue(TopicNames.matches("device/status/#", "device/status/ABC/1/LEVEL"));
        assertTrue(TopicNames.matches("device/status/#", "device/status"));
        assertTrue(TopicNames.matches("device/+/ABC/+/LEVEL", "device/status/ABC/1/LEVEL"));
        assertTrue(TopicNames.matches("sysvar/status/1", "sysvar/status/1"));

        assertFalse(TopicNames.matches("device/+/ABC", "device/status/ABC/1"));
        assertFalse(TopicNames.matches("device/status/ABC/1", "device/status/ABC"));
        assertFalse(TopicNames.matches("sysvar/status/1", "sysvar/status/2"));
    }

    @Test
    void systemTopicsAreNotMatchedByLeadingWildcards()
    {
        assertFalse(TopicNames.matches("#", "$SYS/uptime"));
        assertFalse(TopicNames.matches("+/uptime", "$SYS/uptime"));
        assertTrue(TopicNames.matches("$SYS/#", "$SYS/uptime"));
    }
}
