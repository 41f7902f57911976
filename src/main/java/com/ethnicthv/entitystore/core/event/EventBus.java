package com.ethnicthv.entitystore.core.event;

import com.ethnicthv.entitystore.core.api.IEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default synchronous {@link IEventSink}.
 * <p>
 * Handlers are keyed by the exact event class and run in subscription order. A failing handler
 * does not prevent the remaining handlers from seeing the event; the first failure is rethrown
 * once all of them ran.
 */
public final class EventBus implements IEventSink {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<Class<?>, List<EntityEventHandler<?>>> handlers = new HashMap<>();

    /**
     * Handle returned by {@link #subscribeLocalEvent}; closing it removes the handler.
     */
    public final class Subscription implements AutoCloseable {
        private final Class<?> eventType;
        private final EntityEventHandler<?> handler;

        private Subscription(Class<?> eventType, EntityEventHandler<?> handler) {
            this.eventType = eventType;
            this.handler = handler;
        }

        @Override
        public void close() {
            unsubscribe(eventType, handler);
        }
    }

    public <E> Subscription subscribeLocalEvent(Class<E> eventType, EntityEventHandler<? super E> handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        handlers.computeIfAbsent(eventType, k -> new ArrayList<>()).add(handler);
        return new Subscription(eventType, handler);
    }

    private void unsubscribe(Class<?> eventType, EntityEventHandler<?> handler) {
        List<EntityEventHandler<?>> list = handlers.get(eventType);
        if (list == null) return;
        list.remove(handler);
        if (list.isEmpty()) {
            handlers.remove(eventType);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public void raiseLocalEvent(int entityId, Object event) {
        Objects.requireNonNull(event, "event");
        List<EntityEventHandler<?>> list = handlers.get(event.getClass());
        if (list == null || list.isEmpty()) {
            return;
        }
        RuntimeException first = null;
        // snapshot: handlers may subscribe or unsubscribe while being notified
        for (EntityEventHandler<?> handler : new ArrayList<>(list)) {
            try {
                ((EntityEventHandler<Object>) handler).handle(entityId, event);
            } catch (RuntimeException ex) {
                log.error("Handler for {} on entity {} failed", event.getClass().getSimpleName(), entityId, ex);
                if (first == null) {
                    first = ex;
                } else {
                    first.addSuppressed(ex);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /**
     * Number of handlers currently subscribed to {@code eventType}.
     */
    public int handlerCount(Class<?> eventType) {
        List<EntityEventHandler<?>> list = handlers.get(eventType);
        return list == null ? 0 : list.size();
    }
}
