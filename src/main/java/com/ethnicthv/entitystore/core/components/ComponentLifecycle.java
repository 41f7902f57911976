package com.ethnicthv.entitystore.core.components;

/**
 * Drives {@link Component} life stage transitions on behalf of the store.
 * <p>
 * Callers outside the store should not use this class; it exists so that the directory,
 * index and removal queue, which live in other packages, can move a component through its
 * stages without exposing setters on {@link Component} itself.
 */
public final class ComponentLifecycle {

    private ComponentLifecycle() {
    }

    /**
     * Bind the owner and make the component visible. Fails without side effects if the
     * instance belongs to another entity, is already attached, or was culled.
     */
    public static void attach(Component component, int entityId) {
        checkAttachable(component, entityId);
        component.bindOwner(entityId);
        component.setLifeStage(ComponentLifeStage.ALIVE);
    }

    /**
     * Validate that {@code component} could be attached to {@code entityId} without changing it.
     */
    public static void checkAttachable(Component component, int entityId) {
        if (component.getLifeStage() == ComponentLifeStage.CULLED) {
            throw new IllegalStateException("Component " + component.getClass().getName() + " was already culled and cannot be attached again");
        }
        if (component.getLifeStage() != ComponentLifeStage.CREATED) {
            throw new IllegalStateException("Component " + component.getClass().getName() + " is already attached (" + component.getLifeStage() + ")");
        }
        int owner = component.getOwner();
        if (owner != Component.NO_OWNER && owner != entityId) {
            throw new IllegalArgumentException("Component " + component.getClass().getName()
                    + " is owned by entity " + owner + " and cannot be attached to entity " + entityId);
        }
    }

    public static void notifyAdded(Component component) {
        component.onAdd();
    }

    /**
     * ALIVE -> REMOVED_PENDING_CULL.
     *
     * @return false if the component was not alive (already pending, culled or never attached)
     */
    public static boolean markPending(Component component) {
        if (component.getLifeStage() != ComponentLifeStage.ALIVE) {
            return false;
        }
        component.setLifeStage(ComponentLifeStage.REMOVED_PENDING_CULL);
        return true;
    }

    /**
     * Move to CULLED and run the shutdown hook. The hook runs at most once per instance.
     *
     * @return false if the component had already been culled
     */
    public static boolean shutdown(Component component) {
        if (component.getLifeStage() == ComponentLifeStage.CULLED) {
            return false;
        }
        component.setLifeStage(ComponentLifeStage.CULLED);
        component.onShutdown();
        return true;
    }
}
