package com.ethnicthv.entitystore.core.system;

import com.ethnicthv.entitystore.core.api.IEntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs systems in group priority order and owns the cull point of a tick.
 * <p>
 * Removals requested by any system during {@link #update(float)} are finalized once all groups
 * ran, so every system of a tick sees a stable set of components for the types it iterates.
 */
public class SystemManager {
    private static final Logger log = LoggerFactory.getLogger(SystemManager.class);

    private final IEntityStore store;
    private final boolean cullOnUpdate;
    // TreeMap keeps groups sorted by priority
    private final Map<SystemGroup, List<ISystem>> systemsByGroup = new TreeMap<>();

    public SystemManager(IEntityStore store, boolean cullOnUpdate) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
        this.cullOnUpdate = cullOnUpdate;
        systemsByGroup.put(SystemGroup.INPUT, new ArrayList<>());
        systemsByGroup.put(SystemGroup.SIMULATION, new ArrayList<>());
        systemsByGroup.put(SystemGroup.PHYSICS, new ArrayList<>());
        systemsByGroup.put(SystemGroup.CLEANUP, new ArrayList<>());
    }

    /**
     * Register a system into the default {@link SystemGroup#SIMULATION} group.
     */
    public <T extends ISystem> T registerSystem(T system) {
        return registerSystem(system, SystemGroup.SIMULATION);
    }

    /**
     * Register a system into an explicit execution group.
     */
    public <T extends ISystem> T registerSystem(T system, SystemGroup group) {
        if (system == null) {
            throw new IllegalArgumentException("System cannot be null");
        }
        if (group == null) {
            throw new IllegalArgumentException("SystemGroup cannot be null");
        }
        system.onAwake(store);
        systemsByGroup.computeIfAbsent(group, g -> new ArrayList<>()).add(system);
        log.debug("Registered system {} in group {}", system.getClass().getSimpleName(), group.name());
        return system;
    }

    /**
     * Returns a snapshot of all registered systems in execution order.
     */
    public List<ISystem> getRegisteredSystems() {
        List<ISystem> all = new ArrayList<>();
        for (List<ISystem> list : systemsByGroup.values()) {
            all.addAll(list);
        }
        return all;
    }

    /**
     * Returns the systems registered under a specific group.
     */
    public List<ISystem> getSystems(SystemGroup group) {
        List<ISystem> list = systemsByGroup.get(group);
        return list == null ? List.of() : new ArrayList<>(list);
    }

    /**
     * Execute all enabled systems in a single group. Does not cull.
     */
    public void updateGroup(SystemGroup group, float deltaTime) {
        List<ISystem> list = systemsByGroup.get(group);
        if (list == null) return;
        for (ISystem sys : new ArrayList<>(list)) {
            if (sys.isEnabled()) {
                sys.onUpdate(deltaTime);
            }
        }
    }

    /**
     * Run one tick: every group in priority order, then the cull point.
     */
    public void update(float deltaTime) {
        for (SystemGroup group : new ArrayList<>(systemsByGroup.keySet())) {
            updateGroup(group, deltaTime);
        }
        if (cullOnUpdate) {
            store.cullRemovedComponents();
        }
    }

    /**
     * Dispose every system in reverse execution order.
     */
    public void dispose() {
        List<ISystem> all = getRegisteredSystems();
        for (int i = all.size() - 1; i >= 0; i--) {
            ISystem sys = all.get(i);
            try {
                sys.onDispose();
            } catch (RuntimeException ex) {
                log.warn("System {} failed to dispose", sys.getClass().getName(), ex);
            }
        }
        systemsByGroup.values().forEach(List::clear);
    }
}
