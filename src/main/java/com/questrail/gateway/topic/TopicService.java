package com.questrail.gateway.topic;

/**
 * Second topic level: what a message on the topic means.
 * <ul>
 *   <li>{@link #STATUS}: current value published by the gateway</li>
 *   <li>{@link #SET}: value written by a client</li>
 *   <li>{@link #GET}: client request to republish the current value</li>
 * </ul>
 */
public enum TopicService
{
    STATUS("status"),
    SET("set"),
    GET("get");

    private final String segment;

    TopicService(String segment) {
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }

    static TopicService fromSegment(String segment) {
        for (TopicService s : values()) {
            if (s.segment.equals(segment)) {
                return s;
            }
        }
        throw new AddressFormatException("Unknown topic service: " + segment);
    }
}
