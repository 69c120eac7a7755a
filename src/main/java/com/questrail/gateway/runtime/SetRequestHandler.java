package com.questrail.gateway.runtime;

import com.questrail.gateway.api.ProcessValue;
import com.questrail.gateway.topic.Topic;

/**
 * Receives values clients publish on {@code {category}/set/...} topics.
 *
 * <p>Invoked on the broker delivery thread. Implementations forward the value
 * to the controller and must not block.</p>
 */
@FunctionalInterface
public interface SetRequestHandler
{
    /**
     * @param topic parsed set topic; {@link Topic#withService} yields the
     *              matching status topic
     * @param value decoded value; never {@code null}
     */
    void onSetRequest(Topic topic, ProcessValue value);
}
