package com.questrail.gateway.broker.internal;

import com.questrail.gateway.api.QualityOfService;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Topic filter → subscribers table.
 *
 * <p>Safe for concurrent use. A subscriber matching a topic through several
 * filters is delivered once, at the highest granted QoS.</p>
 */
final class SubscriptionRegistry
{
    private final ConcurrentHashMap<String, ConcurrentHashMap<Subscriber, QualityOfService>> byFilter =
            new ConcurrentHashMap<>();

    void add(String filter, Subscriber subscriber, QualityOfService qos) {
        byFilter.computeIfAbsent(filter, f -> new ConcurrentHashMap<>()).put(subscriber, qos);
    }

    boolean remove(String filter, Subscriber subscriber) {
        boolean[] removed = new boolean[1];
        byFilter.computeIfPresent(filter, (f, subs) -> {
            removed[0] = subs.remove(subscriber) != null;
            return subs.isEmpty() ? null : subs;
        });
        return removed[0];
    }

    /**
     * Subscribers of the topic with their granted QoS, in no particular order.
     */
    Map<Subscriber, QualityOfService> match(String topic) {
        Map<Subscriber, QualityOfService> result = new LinkedHashMap<>();
        byFilter.forEach((filter, subs) -> {
            if (TopicNames.matches(filter, topic)) {
                subs.forEach((subscriber, qos) -> result.merge(subscriber, qos,
                        (a, b) -> a.value() >= b.value() ? a : b));
            }
        });
        return result;
    }

    int filterCount() {
        return byFilter.size();
    }
}
