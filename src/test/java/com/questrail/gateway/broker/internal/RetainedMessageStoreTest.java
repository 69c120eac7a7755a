package com.questrail.gateway.broker.internal;

import com.questrail.gateway.api.QualityOfService;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class RetainedMessageStoreTest
{
    private final RetainedMessageStore store = new RetainedMessageStore();

    private static BrokerMessage msg(String topic, String payload) {
        return new BrokerMessage(topic, payload.getBytes(), QualityOfService.AT_LEAST_ONCE, true);
    }

    @Test
    void latestMessageWins()
    {
        store.update(msg("a/b", "1"));
        store.update(msg("a/b", "2"));

        assertEquals(1, store.size());
        assertArrayEquals("2".getBytes(), store.get("a/b").orElseThrow().payload());
    }

    @Test
    void emptyPayloadClearsTopic()
    {
        store.update(msg("a/b", "1"));
        store.update(msg("a/b", ""));

        assertTrue(store.get("a/b").isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void matchingUsesFilters()
    {
        store.update(msg("device/status/A/1/LEVEL", "1"));
        store.update(msg("device/status/B/1/STATE", "2"));
        store.update(msg("sysvar/status/7", "3"));

        assertEquals(2, store.matching("device/status/#").size());
        assertEquals(1, store.matching("+/status/7").size());
        assertEquals(3, store.matching("#").size());
    }
}
