package com.questrail.gateway.broker.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last retained message per topic.
 */
final class RetainedMessageStore
{
    private final ConcurrentHashMap<String, BrokerMessage> byTopic = new ConcurrentHashMap<>();

    /**
     * Stores the message as the topic's retained message, or clears the topic
     * if the payload is empty.
     */
    void update(BrokerMessage message) {
        if (message.payload().length == 0) {
            byTopic.remove(message.topic());
        } else {
            byTopic.put(message.topic(), message.withRetain(true));
        }
    }

    List<BrokerMessage> matching(String filter) {
        List<BrokerMessage> result = new ArrayList<>();
        byTopic.forEach((topic, message) -> {
            if (TopicNames.matches(filter, topic)) {
                result.add(message);
            }
        });
        return result;
    }

    Optional<BrokerMessage> get(String topic) {
        return Optional.ofNullable(byTopic.get(topic));
    }

    int size() {
        return byTopic.size();
    }
}
