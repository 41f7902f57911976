package com.ethnicthv.entitystore.core.view;

/**
 * Raised when a subscriber is explicitly unsubscribed from an entity's view.
 * Not raised when subscriptions are dropped because the entity is destroyed.
 */
public record SubscriptionRemovedEvent(int entityId, Object subscriber) {
}
