package com.ethnicthv.entitystore.core.components;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Base class for all components.
 * <p>
 * A component is attached to exactly one entity for its whole life. The owner is bound on the
 * first attach and never changes afterwards. The store drives the life stage; subclasses only
 * observe it through {@link #onAdd()} and {@link #onShutdown()}.
 */
public abstract class Component {

    /**
     * Marks a component type as networked. The registry assigns the type a stable network id,
     * either the explicit {@link #id()} or the next free one in registration order.
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.TYPE)
    public @interface Networked {
        /**
         * Explicit network id (-1 means auto-assign)
         */
        int id() default -1;
    }

    /**
     * Overrides the registration name of a component type.
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.TYPE)
    public @interface Name {
        String value();
    }

    public static final int NO_OWNER = 0;

    private int owner = NO_OWNER;
    private ComponentLifeStage lifeStage = ComponentLifeStage.CREATED;

    /**
     * The owning entity, or {@link #NO_OWNER} if this instance was never attached.
     */
    public final int getOwner() {
        return owner;
    }

    public final ComponentLifeStage getLifeStage() {
        return lifeStage;
    }

    /**
     * True only while attached and not marked for removal.
     */
    public final boolean isAlive() {
        return lifeStage == ComponentLifeStage.ALIVE;
    }

    /**
     * True once removal was requested, whether or not the component was culled yet.
     */
    public final boolean isDeleted() {
        return lifeStage == ComponentLifeStage.REMOVED_PENDING_CULL || lifeStage == ComponentLifeStage.CULLED;
    }

    /**
     * Called after the component became visible on its owner.
     */
    protected void onAdd() {
    }

    /**
     * Called exactly once when the component is finally detached (cull, overwrite or entity destruction).
     */
    protected void onShutdown() {
    }

    // ---- transitions driven by ComponentLifecycle ----

    final void bindOwner(int entityId) {
        owner = entityId;
    }

    final void setLifeStage(ComponentLifeStage stage) {
        this.lifeStage = stage;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[owner=" + owner + ", stage=" + lifeStage + "]";
    }
}
