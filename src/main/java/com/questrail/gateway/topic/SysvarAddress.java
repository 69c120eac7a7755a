package com.questrail.gateway.topic;

/**
 * Address of a controller system variable, by its numeric or symbolic id.
 */
public record SysvarAddress(String id)
{
    public SysvarAddress {
        DeviceAddress.requireSegment(id, "system variable id");
    }
}
