package com.ethnicthv.entitystore.core.view;

import com.ethnicthv.entitystore.core.InvalidEntityException;
import com.ethnicthv.entitystore.core.api.IEventSink;
import com.ethnicthv.entitystore.core.entity.EntityDestructionListener;
import com.ethnicthv.entitystore.core.entity.EntityDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Tracks which subscribers watch which entities' views.
 * <p>
 * The relation is kept from both sides, entity -> subscribers and subscriber -> entities, as
 * plain identifier lookups; neither side owns the other. Subscribing and unsubscribing are
 * idempotent. When an entity is destroyed its subscriptions are dropped silently: no
 * {@link SubscriptionRemovedEvent} is raised for them.
 *
 * @param <S> subscriber identity; must have stable equals/hashCode
 */
public final class SubscriptionLedger<S> implements EntityDestructionListener {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionLedger.class);

    private final EntityDirectory directory;
    private final IEventSink events;
    private final Map<Integer, Set<S>> subscribersByEntity = new HashMap<>();
    private final Map<S, Set<Integer>> entitiesBySubscriber = new HashMap<>();

    public SubscriptionLedger(EntityDirectory directory, IEventSink events) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Subscribe {@code subscriber} to the view of {@code entityId}.
     *
     * @return false if it was already subscribed (nothing happens then)
     * @throws InvalidEntityException if the entity does not exist
     */
    public boolean subscribe(int entityId, S subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        if (!directory.entityExists(entityId)) {
            throw new InvalidEntityException(entityId);
        }
        Set<S> subscribers = subscribersByEntity.computeIfAbsent(entityId, k -> new LinkedHashSet<>());
        if (!subscribers.add(subscriber)) {
            return false;
        }
        entitiesBySubscriber.computeIfAbsent(subscriber, k -> new LinkedHashSet<>()).add(entityId);
        log.debug("{} subscribed to entity {}", subscriber, entityId);
        events.raiseLocalEvent(entityId, new SubscriptionAddedEvent(entityId, subscriber));
        return true;
    }

    /**
     * Unsubscribe {@code subscriber} from {@code entityId}.
     *
     * @return false if it was not subscribed (nothing happens then)
     */
    public boolean unsubscribe(int entityId, S subscriber) {
        if (subscriber == null) {
            return false;
        }
        Set<S> subscribers = subscribersByEntity.get(entityId);
        if (subscribers == null || !subscribers.remove(subscriber)) {
            return false;
        }
        if (subscribers.isEmpty()) {
            subscribersByEntity.remove(entityId);
        }
        removeSubscriberSide(subscriber, entityId);
        log.debug("{} unsubscribed from entity {}", subscriber, entityId);
        events.raiseLocalEvent(entityId, new SubscriptionRemovedEvent(entityId, subscriber));
        return true;
    }

    /**
     * Explicitly unsubscribe {@code subscriber} from everything it watches, raising a
     * {@link SubscriptionRemovedEvent} per entity.
     *
     * @return number of subscriptions removed
     */
    public int unsubscribeAll(S subscriber) {
        Set<Integer> watched = entitiesBySubscriber.get(subscriber);
        if (watched == null) {
            return 0;
        }
        int removed = 0;
        for (Integer entityId : new ArrayList<>(watched)) {
            if (unsubscribe(entityId, subscriber)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Entity shutdown: drop every subscription to the entity from the subscriber side first,
     * then the entity entry, without raising removal events.
     */
    @Override
    public void onEntityShutdown(int entityId) {
        Set<S> subscribers = subscribersByEntity.get(entityId);
        if (subscribers == null) {
            return;
        }
        List<S> snapshot = new ArrayList<>(subscribers);
        for (S subscriber : snapshot) {
            removeSubscriberSide(subscriber, entityId);
        }
        subscribersByEntity.remove(entityId);
        log.debug("Dropped {} subscriptions of destroyed entity {}", snapshot.size(), entityId);
    }

    private void removeSubscriberSide(S subscriber, int entityId) {
        Set<Integer> watched = entitiesBySubscriber.get(subscriber);
        if (watched == null) return;
        watched.remove(entityId);
        if (watched.isEmpty()) {
            entitiesBySubscriber.remove(subscriber);
        }
    }

    public boolean isSubscribed(int entityId, S subscriber) {
        Set<S> subscribers = subscribersByEntity.get(entityId);
        return subscribers != null && subscribers.contains(subscriber);
    }

    /**
     * Snapshot of the subscribers of an entity, in subscription order.
     */
    public Set<S> getSubscribers(int entityId) {
        Set<S> subscribers = subscribersByEntity.get(entityId);
        return subscribers == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(subscribers));
    }

    /**
     * Snapshot of the entities a subscriber watches, in subscription order.
     */
    public Set<Integer> getSubscriptions(S subscriber) {
        Set<Integer> watched = entitiesBySubscriber.get(subscriber);
        return watched == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(watched));
    }

    /**
     * Total number of (entity, subscriber) pairs.
     */
    public int size() {
        int n = 0;
        for (Set<S> subscribers : subscribersByEntity.values()) {
            n += subscribers.size();
        }
        return n;
    }
}
