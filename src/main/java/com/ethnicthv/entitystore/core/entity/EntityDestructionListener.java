package com.ethnicthv.entitystore.core.entity;

/**
 * Notified by {@link EntityDirectory#destroyEntity(int)} before any component of the entity is
 * culled. During the call the entity is still known to the directory but no longer exists for
 * new attaches or subscriptions. The id must not be retained afterwards.
 */
@FunctionalInterface
public interface EntityDestructionListener {
    void onEntityShutdown(int entityId);
}
