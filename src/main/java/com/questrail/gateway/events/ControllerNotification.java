package com.questrail.gateway.events;

import java.util.List;
import java.util.Objects;

/**
 * ControllerNotification
 * -----------------------------------------------------------------------------
 * Callback notifications received from the home automation controller.
 *
 * <p>Every notification carries the id of the controller interface that
 * raised it. Notifications are immutable and handed to every
 * {@link NotificationHandler} of the {@link HandlerChain}.</p>
 */
public sealed interface ControllerNotification
        permits ControllerNotification.ValueChanged,
                ControllerNotification.DevicesAdded,
                ControllerNotification.DevicesDeleted,
                ControllerNotification.DeviceUpdated,
                ControllerNotification.DeviceReplaced,
                ControllerNotification.DevicesReadded
{
    String interfaceId();

    /**
     * A data point of a channel changed.
     *
     * @param address  channel address, {@code serial:channel}
     * @param valueKey parameter name, e.g. {@code LEVEL}
     * @param value    new value; a scalar or {@code null}
     */
    record ValueChanged(String interfaceId, String address, String valueKey, Object value)
            implements ControllerNotification
    {
        public ValueChanged {
            Objects.requireNonNull(interfaceId, "interfaceId");
            Objects.requireNonNull(address, "address");
            Objects.requireNonNull(valueKey, "valueKey");
        }
    }

    /** Devices were paired with the controller. */
    record DevicesAdded(String interfaceId, List<DeviceDescription> devices)
            implements ControllerNotification
    {
        public DevicesAdded {
            Objects.requireNonNull(interfaceId, "interfaceId");
            devices = List.copyOf(devices);
        }
    }

    /** Devices were removed from the controller. */
    record DevicesDeleted(String interfaceId, List<String> addresses)
            implements ControllerNotification
    {
        public DevicesDeleted {
            Objects.requireNonNull(interfaceId, "interfaceId");
            addresses = List.copyOf(addresses);
        }
    }

    /**
     * The description of a device changed.
     *
     * @param hint 0: description changed, 1: link partners changed
     */
    record DeviceUpdated(String interfaceId, String address, int hint)
            implements ControllerNotification
    {
        public DeviceUpdated {
            Objects.requireNonNull(interfaceId, "interfaceId");
            Objects.requireNonNull(address, "address");
        }
    }

    /** A device was replaced by a new one. */
    record DeviceReplaced(String interfaceId, String oldAddress, String newAddress)
            implements ControllerNotification
    {
        public DeviceReplaced {
            Objects.requireNonNull(interfaceId, "interfaceId");
            Objects.requireNonNull(oldAddress, "oldAddress");
            Objects.requireNonNull(newAddress, "newAddress");
        }
    }

    /** Previously deleted devices were paired again. */
    record DevicesReadded(String interfaceId, List<String> addresses)
            implements ControllerNotification
    {
        public DevicesReadded {
            Objects.requireNonNull(interfaceId, "interfaceId");
            addresses = List.copyOf(addresses);
        }
    }
}
