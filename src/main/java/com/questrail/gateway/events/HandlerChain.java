package com.questrail.gateway.events;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * HandlerChain
 * =============================================================================
 * Ordered, immutable list of {@link NotificationHandler}s composed once at
 * startup.
 *
 * <h2>Delivery</h2>
 * Every notification is handed to every handler, synchronously and in list
 * order. A failing handler never prevents delivery to the handlers after it.
 * When one or more handlers failed, a {@link NotificationDeliveryException}
 * is thrown after the pass, carrying the first failure as cause and the
 * others as suppressed exceptions.
 *
 * <p>The chain is itself a handler, so chains nest.</p>
 */
public final class HandlerChain implements NotificationHandler
{
    private final List<NotificationHandler> handlers;

    public HandlerChain(List<? extends NotificationHandler> handlers) {
        Objects.requireNonNull(handlers, "handlers");
        for (NotificationHandler h : handlers) {
            Objects.requireNonNull(h, "handler");
        }
        this.handlers = List.copyOf(handlers);
    }

    public static HandlerChain of(NotificationHandler... handlers) {
        return new HandlerChain(List.of(handlers));
    }

    public List<NotificationHandler> handlers() {
        return handlers;
    }

    /**
     * @throws NotificationDeliveryException if any handler failed
     */
    @Override
    public void handle(ControllerNotification notification) {
        Objects.requireNonNull(notification, "notification");

        List<RuntimeException> failures = null;
        for (NotificationHandler h : handlers) {
            try {
                h.handle(notification);
            } catch (RuntimeException e) {
                if (failures == null) {
                    failures = new ArrayList<>();
                }
                failures.add(e);
            }
        }

        if (failures != null) {
            RuntimeException first = failures.get(0);
            NotificationDeliveryException ex = new NotificationDeliveryException(
                    "Delivery of " + notification.getClass().getSimpleName() + " failed in "
                            + failures.size() + " handler(s): " + first.getMessage(),
                    first);
            for (int i = 1; i < failures.size(); i++) {
                ex.addSuppressed(failures.get(i));
            }
            throw ex;
        }
    }
}
