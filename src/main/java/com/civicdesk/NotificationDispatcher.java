package com.civicdesk;

import com.civicdesk.events.DomainEvent;
import com.civicdesk.events.EventHandler;
import com.civicdesk.events.EventKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process fan-out of domain events. Handlers run in registration order;
 * a failing handler is logged and skipped so the rest still run. Dispatch happens after
 * the triggering operation has committed, so handler failures, assertion errors and
 * linkage errors included, never reach the caller. Other errors (out of memory, stack
 * overflow) still propagate.
 */
public class NotificationDispatcher {

    private final Map<EventKind, List<EventHandler>> handlers = new EnumMap<>(EventKind.class);

    public NotificationDispatcher() {
        for (EventKind kind : EventKind.values()) {
            handlers.put(kind, new CopyOnWriteArrayList<>());
        }
    }

    public void subscribe(EventKind kind, EventHandler handler) {
        if (kind == null || handler == null) {
            throw new IllegalArgumentException("Event kind and handler are required");
        }
        handlers.get(kind).add(handler);
    }

    public void subscribeAll(EventHandler handler) {
        for (EventKind kind : EventKind.values()) {
            subscribe(kind, handler);
        }
    }

    public boolean unsubscribe(EventKind kind, EventHandler handler) {
        return kind != null && handlers.get(kind).remove(handler);
    }

    public int handlerCount(EventKind kind) {
        return handlers.get(kind).size();
    }

    /**
     * @return number of handlers that completed without throwing
     */
    public int dispatch(DomainEvent event) {
        if (event == null) {
            return 0;
        }
        List<EventHandler> targets = handlers.get(event.getKind());
        logDebug("Dispatching " + event.getKind() + " to " + targets.size() + " handler(s)");
        int delivered = 0;
        for (EventHandler handler : targets) {
            try {
                handler.handle(event);
                delivered++;
            } catch (Exception | AssertionError | LinkageError e) {
                logError("Handler failed for " + event + ": " + e.getMessage(), e);
            }
        }
        return delivered;
    }

    private void logDebug(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.debug("[NotificationDispatcher] " + message);
        }
    }

    private void logError(String message, Throwable t) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.error("[NotificationDispatcher] " + message, t);
        } else {
            System.err.println("[NotificationDispatcher] " + message);
        }
    }
}
