package com.questrail.gateway.events;

import java.util.Objects;

/**
 * Description of a device or channel announced by the controller.
 *
 * @param address device serial or {@code serial:channel} channel address
 * @param type    device or channel type as reported by the controller
 * @param parent  address of the parent device; empty for devices
 * @param version description version
 */
public record DeviceDescription(String address, String type, String parent, int version)
{
    public DeviceDescription {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(type, "type");
        parent = parent == null ? "" : parent;
    }

    public boolean isChannel() {
        return !parent.isEmpty();
    }
}
