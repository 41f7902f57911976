package com.ethnicthv.entitystore.core.event;

import com.ethnicthv.entitystore.core.components.Component;

/**
 * Raised once per component instance when it is finally detached: at cull, when displaced by an
 * overwrite, or when its owner is destroyed. The component's own shutdown hook has already run.
 */
public record ComponentShutdownEvent(int entityId, Component component) {
}
