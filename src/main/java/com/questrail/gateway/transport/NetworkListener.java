package com.questrail.gateway.transport;

import com.questrail.gateway.config.ListenerConfig;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * NetworkListener
 * -----------------------------------------------------------------------------
 * Port for one server socket accepting MQTT client connections.
 *
 * <p>A listener is driven by exactly one task owned by {@link ListenerManager}.
 * The task calls {@link #serve(Runnable)}, which blocks for the lifetime of the
 * listener. Any other thread may call {@link #close()}.</p>
 *
 * <p>Implementations may be backed by Netty or by a test double.</p>
 */
public interface NetworkListener
{
    ListenerConfig config();

    /**
     * Prepare transport resources, bind, and serve until closed.
     *
     * <p>{@code onBound} is invoked exactly once, after the bind succeeded and
     * before connections are served. It is never invoked if preparation or
     * binding fails.</p>
     *
     * <p>Returns normally only when the listener was closed through
     * {@link #close()}.</p>
     *
     * @throws ListenerException if preparation or binding fails, or the
     *         listener stops without having been closed
     */
    void serve(Runnable onBound);

    /**
     * Request shutdown. Idempotent. Safe to call before, during or after
     * {@link #serve(Runnable)}.
     */
    void close();

    /**
     * Actual bound address once bound (relevant for port 0).
     */
    Optional<InetSocketAddress> boundAddress();
}
