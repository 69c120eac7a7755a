package com.questrail.gateway.events;

/**
 * A receiver of controller notifications.
 *
 * <p>Handlers are invoked synchronously on the thread delivering the
 * notification. A handler that cannot process a notification throws; the
 * {@link HandlerChain} still hands the notification to later handlers.</p>
 */
@FunctionalInterface
public interface NotificationHandler
{
    void handle(ControllerNotification notification);
}
