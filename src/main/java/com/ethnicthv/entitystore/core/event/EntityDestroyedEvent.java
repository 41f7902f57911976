package com.ethnicthv.entitystore.core.event;

/**
 * Raised after all components of an entity were culled, right before its id is forgotten.
 */
public record EntityDestroyedEvent(int entityId) {
}
