package com.ethnicthv.entitystore.core.event;

@FunctionalInterface
public interface EntityEventHandler<E> {
    void handle(int entityId, E event);
}
