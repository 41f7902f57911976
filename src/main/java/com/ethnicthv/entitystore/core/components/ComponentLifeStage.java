package com.ethnicthv.entitystore.core.components;

/**
 * Life stage of a component instance. Transitions only move forward:
 * CREATED -> ALIVE -> (REMOVED_PENDING_CULL ->) CULLED.
 */
public enum ComponentLifeStage {
    /** Constructed but never attached. */
    CREATED,
    /** Attached and visible to lookups and queries. */
    ALIVE,
    /** Removal requested; still stored and indexed but invisible until the next cull. */
    REMOVED_PENDING_CULL,
    /** Detached for good; shutdown has run. */
    CULLED
}
