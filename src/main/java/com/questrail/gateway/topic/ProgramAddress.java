package com.questrail.gateway.topic;

/**
 * Address of a controller program.
 */
public record ProgramAddress(String id)
{
    public ProgramAddress {
        DeviceAddress.requireSegment(id, "program id");
    }
}
