package com.ethnicthv.entitystore.core.view;

/**
 * Raised when a subscriber starts watching an entity's view.
 */
public record SubscriptionAddedEvent(int entityId, Object subscriber) {
}
