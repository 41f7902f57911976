package com.ethnicthv.entitystore.core;

/**
 * Thrown when attaching a component without overwrite while a live one of the same type exists.
 */
public class ComponentAlreadyAttachedException extends EntityStoreException {
    private final int entityId;
    private final Class<?> componentType;

    public ComponentAlreadyAttachedException(int entityId, Class<?> componentType) {
        super("Entity " + entityId + " already has a live component of type " + componentType.getName());
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
