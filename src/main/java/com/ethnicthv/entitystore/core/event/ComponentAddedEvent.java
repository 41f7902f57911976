package com.ethnicthv.entitystore.core.event;

import com.ethnicthv.entitystore.core.components.Component;

/**
 * Raised after a component became live on its owner.
 */
public record ComponentAddedEvent(int entityId, Component component) {
}
