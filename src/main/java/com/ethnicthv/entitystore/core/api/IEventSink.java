package com.ethnicthv.entitystore.core.api;

/**
 * Opaque publish primitive the store raises its notifications through.
 * <p>
 * Delivery must be synchronous and ordered: every handler has run by the time
 * {@link #raiseLocalEvent(int, Object)} returns.
 */
@FunctionalInterface
public interface IEventSink {

    /**
     * Raise {@code event} addressed to listeners of {@code entityId}.
     */
    void raiseLocalEvent(int entityId, Object event);

    /**
     * A sink that drops every event.
     */
    IEventSink NONE = (entityId, event) -> { };
}
