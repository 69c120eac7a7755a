package com.questrail.gateway.api;

import java.util.Objects;

/**
 * How a translated controller event is published: delivery guarantee and
 * whether the broker keeps it as the last known value of the topic.
 */
public record PublishDecision(QualityOfService qos, boolean retain)
{
    public static final PublishDecision STEADY_STATE =
            new PublishDecision(QualityOfService.AT_LEAST_ONCE, true);

    public static final PublishDecision TRANSIENT =
            new PublishDecision(QualityOfService.EXACTLY_ONCE, false);

    public PublishDecision {
        Objects.requireNonNull(qos, "qos");
    }
}
