package com.questrail.gateway.topic;

import java.util.Objects;

/**
 * Address of a single data point of a device channel: {@code serial:channel}
 * plus a parameter name.
 */
public record DeviceAddress(String device, String channel, String parameter)
{
    public DeviceAddress {
        requireSegment(device, "device");
        requireSegment(channel, "channel");
        requireSegment(parameter, "parameter");
    }

    /**
     * Parses a channel address of the form {@code serial:channel}.
     *
     * @throws AddressFormatException if the address does not contain exactly
     *         one separator or either side is empty
     */
    public static DeviceAddress parse(String channelAddress, String parameter) {
        Objects.requireNonNull(channelAddress, "channelAddress");

        int p = channelAddress.indexOf(':');
        if (p == -1 || channelAddress.indexOf(':', p + 1) != -1) {
            throw new AddressFormatException("Unexpected event from a device: " + channelAddress);
        }
        return new DeviceAddress(channelAddress.substring(0, p), channelAddress.substring(p + 1), parameter);
    }

    /**
     * The controller's channel address, {@code serial:channel}.
     */
    public String channelAddress() {
        return device + ":" + channel;
    }

    static void requireSegment(String segment, String what) {
        if (segment == null || segment.isEmpty()) {
            throw new AddressFormatException("Empty " + what);
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == '/' || c == '+' || c == '#' || c == '\u0000') {
                throw new AddressFormatException("Illegal character in " + what + ": " + segment);
            }
        }
    }
}
