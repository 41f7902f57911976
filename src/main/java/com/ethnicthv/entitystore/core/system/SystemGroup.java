package com.ethnicthv.entitystore.core.system;

import java.util.Objects;

/**
 * Ordered phase of a store tick. {@link SystemManager} runs groups by ascending priority, ties
 * broken by name, and culls removed components once the last group finished.
 * <p>
 * The four built-in phases leave gaps so custom groups can be slotted in between, e.g.
 * {@code new SystemGroup("Ai", 1500)} runs after simulation and before physics.
 */
public record SystemGroup(String name, int priority) implements Comparable<SystemGroup> {

    /** Reads external input into components. */
    public static final SystemGroup INPUT = new SystemGroup("Input", 0);
    /** Default group for game rules. */
    public static final SystemGroup SIMULATION = new SystemGroup("Simulation", 1000);
    public static final SystemGroup PHYSICS = new SystemGroup("Physics", 2000);
    /** Last phase before the cull point; sees every removal of the tick as already invisible. */
    public static final SystemGroup CLEANUP = new SystemGroup("Cleanup", 4000);

    public SystemGroup {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public int compareTo(SystemGroup other) {
        int byPriority = Integer.compare(priority, other.priority);
        return byPriority != 0 ? byPriority : name.compareTo(other.name);
    }
}
