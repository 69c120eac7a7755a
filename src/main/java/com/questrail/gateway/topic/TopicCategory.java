package com.questrail.gateway.topic;

/**
 * First topic level: the kind of object addressed.
 */
public enum TopicCategory
{
    DEVICE("device"),
    SYSVAR("sysvar"),
    PROGRAM("program");

    private final String segment;

    TopicCategory(String segment) {
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }

    static TopicCategory fromSegment(String segment) {
        for (TopicCategory c : values()) {
            if (c.segment.equals(segment)) {
                return c;
            }
        }
        throw new AddressFormatException("Unknown topic category: " + segment);
    }
}
