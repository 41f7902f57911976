package com.ethnicthv.entitystore.core.query;

import com.ethnicthv.entitystore.core.components.Component;

/**
 * One query result: a component together with its concrete type and owning entity.
 */
public record ComponentEntry<T extends Component>(Class<T> type, int entityId, T component) {
}
