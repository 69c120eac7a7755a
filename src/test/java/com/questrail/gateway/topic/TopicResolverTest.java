package com.questrail.gateway.topic;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TopicResolverTest
{
    @Test
    void deviceStatusTopicSplitsChannelAddress()
    {
        Topic topic = TopicResolver.deviceStatusTopic("AABB1234:3", "STATE");

        assertEquals("device/status/AABB1234/3/STATE", topic.name());
        assertEquals(new DeviceAddress("AABB1234", "3", "STATE"), topic.deviceAddress());
        assertEquals("AABB1234:3", topic.deviceAddress().channelAddress());
    }

    @Test
    void addressWithoutSeparatorIsRejected()
    {
        AddressFormatException e = assertThrows(AddressFormatException.class,
            () -> TopicResolver.deviceStatusTopic("AABB1234", "STATE"));
        assertTrue(e.getMessage().contains("AABB1234"));
    }

    @Test
    void addressWithSeveralSeparatorsIsRejected()
    {
        assertThrows(AddressFormatException.class,
            () -> TopicResolver.deviceStatusTopic("AABB:1:2", "STATE"));
    }

    @Test
    void emptyAddressSidesAreRejected()
    {
        assertThrows(AddressFormatException.class, () -> TopicResolver.deviceStatusTopic(":3", "STATE"));
        assertThrows(AddressFormatException.class, () -> TopicResolver.deviceStatusTopic("AABB:", "STATE"));
    }

    @Test
    void parameterMustBeUsableAsTopicLevel()
    {
        assertThrows(AddressFormatException.class, () -> TopicResolver.deviceStatusTopic("A:1", ""));
        assertThrows(AddressFormatException.class, () -> TopicResolver.deviceStatusTopic("A:1", "A/B"));
        assertThrows(AddressFormatException.class, () -> TopicResolver.deviceStatusTopic("A:1", "#"));
    }

    @Test
    void sysvarAndProgramTopics()
    {
        Topic sysvar = TopicResolver.sysvarStatusTopic(new SysvarAddress("1234"));
        Topic program = TopicResolver.programStatusTopic(new ProgramAddress("950"));

        assertEquals("sysvar/status/1234", sysvar.name());
        assertEquals(new SysvarAddress("1234"), sysvar.sysvarAddress());
        assertEquals("program/status/950", program.name());
        assertEquals(new ProgramAddress("950"), program.programAddress());
    }

    @Test
    void sysvarAndProgramIdsMustBeUsableAsTopicLevel()
    {
        assertThrows(AddressFormatException.class, () -> new SysvarAddress(""));
        assertThrows(AddressFormatException.class, () -> new SysvarAddress("a/b"));
        assertThrows(AddressFormatException.class, () -> new ProgramAddress("+"));
        assertThrows(IllegalStateException.class,
            () -> TopicResolver.deviceStatusTopic("A:1", "STATE").sysvarAddress());
    }
}
