package com.ethnicthv.entitystore.core.system;

import com.ethnicthv.entitystore.core.api.IEntityStore;

/**
 * A unit of per-tick logic run by {@link SystemManager} against one {@link IEntityStore}.
 * <p>
 * Removals a system requests during {@link #onUpdate(float)} are only marked: the components
 * disappear from lookups and queries at once, but they are detached (and their shutdown hooks
 * run) at the cull point, after every group of the tick has run. A system may therefore mark
 * components while iterating a query over their type, but must not attach components of that
 * type in the same loop.
 */
public interface ISystem {

    /**
     * Receives the store this system is registered with. Runs before the first tick.
     */
    void onAwake(IEntityStore store);

    /**
     * @param deltaTime seconds since the previous tick, as passed to {@link SystemManager#update(float)}
     */
    void onUpdate(float deltaTime);

    /**
     * Last call the system gets. The store still holds its entities at this point.
     */
    void onDispose();

    boolean isEnabled();

    /**
     * A disabled system keeps its group slot but is skipped by ticks.
     */
    void setEnabled(boolean enabled);
}
