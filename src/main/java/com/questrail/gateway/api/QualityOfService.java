package com.questrail.gateway.api;

/**
 * QualityOfService
 * -----------------------------------------------------------------------------
 * MQTT delivery guarantee of a publication or subscription.
 */
public enum QualityOfService
{
    AT_MOST_ONCE(0),
    AT_LEAST_ONCE(1),
    EXACTLY_ONCE(2);

    private final int value;

    QualityOfService(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Maps a numeric QoS level to its enum constant.
     *
     * @throws IllegalArgumentException if {@code value} is not 0, 1 or 2
     */
    public static QualityOfService fromValue(int value) {
        switch (value) {
            case 0:
                return AT_MOST_ONCE;
            case 1:
                return AT_LEAST_ONCE;
            case 2:
                return EXACTLY_ONCE;
            default:
                throw new IllegalArgumentException("Invalid QoS: " + value);
        }
    }

    /**
     * Returns the lower of the two levels.
     */
    public static QualityOfService min(QualityOfService a, QualityOfService b) {
        return a.value <= b.value ? a : b;
    }
}
