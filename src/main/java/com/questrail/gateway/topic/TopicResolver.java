package com.questrail.gateway.topic;

/**
 * TopicResolver
 * -----------------------------------------------------------------------------
 * Maps controller addresses to the topics their current values are published
 * on. Pure functions; no state.
 */
public final class TopicResolver
{
    private TopicResolver() {}

    /**
     * {@code device/status/{serial}/{channel}/{parameter}}.
     *
     * @param channelAddress controller channel address, {@code serial:channel}
     * @param parameter      parameter name, e.g. {@code STATE}
     * @throws AddressFormatException if the address is malformed
     */
    public static Topic deviceStatusTopic(String channelAddress, String parameter) {
        return Topic.device(TopicService.STATUS, DeviceAddress.parse(channelAddress, parameter));
    }

    /**
     * {@code sysvar/status/{id}}.
     */
    public static Topic sysvarStatusTopic(SysvarAddress address) {
        return Topic.sysvar(TopicService.STATUS, address);
    }

    /**
     * {@code program/status/{id}}.
     */
    public static Topic programStatusTopic(ProgramAddress address) {
        return Topic.program(TopicService.STATUS, address);
    }
}
