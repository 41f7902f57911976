package com.ethnicthv.entitystore.core;

/**
 * Thrown when an operation targets an entity that was never created or has been destroyed.
 */
public class InvalidEntityException extends EntityStoreException {
    private final int entityId;

    public InvalidEntityException(int entityId) {
        super("Entity " + entityId + " does not exist");
        this.entityId = entityId;
    }

    public int getEntityId() {
        return entityId;
    }
}
