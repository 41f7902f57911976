package com.ethnicthv.entitystore.core;

/**
 * Thrown by a strict lookup when the entity holds no live component of the requested type.
 * Components pending removal count as absent.
 */
public class ComponentNotFoundException extends EntityStoreException {
    private final int entityId;
    private final Class<?> componentType;

    public ComponentNotFoundException(int entityId, Class<?> componentType) {
        super("Entity " + entityId + " has no live component of type " + componentType.getName());
        this.entityId = entityId;
        this.componentType = componentType;
    }

    public int getEntityId() {
        return entityId;
    }

    public Class<?> getComponentType() {
        return componentType;
    }
}
