package com.ethnicthv.entitystore.core.system;

import com.ethnicthv.entitystore.core.api.IEntityStore;

/**
 * Base for systems that only need {@link #onUpdate(float)}.
 * <p>
 * Keeps the store handed over by {@link #onAwake(IEntityStore)} in {@link #store} and starts
 * enabled. Subclasses overriding {@code onAwake} must call {@code super.onAwake(store)}.
 */
public abstract class BaseSystem implements ISystem {

    /** Null until the system is registered. */
    protected IEntityStore store;
    private boolean enabled = true;

    @Override
    public void onAwake(IEntityStore store) {
        this.store = store;
    }

    @Override
    public void onDispose() {
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
