package com.ethnicthv.entitystore.core.index;

import com.ethnicthv.entitystore.core.UnknownNetworkIdException;
import com.ethnicthv.entitystore.core.api.IComponentRegistry;
import com.ethnicthv.entitystore.core.components.Component;
import com.ethnicthv.entitystore.core.components.ComponentLifeStage;

import java.util.Collections;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * ComponentIndex - component type to holding entities, plus network id translation.
 * <p>
 * Each concrete type owns a bucket of entity -> component in attach order. Entries stay in
 * their bucket while {@link ComponentLifeStage#REMOVED_PENDING_CULL}; iterators skip them, so
 * marking a component removed never disturbs an iteration in progress. Registering or
 * unregistering is a structural change: any live iterator over that bucket fails with
 * {@link ConcurrentModificationException} on its next step.
 * <p>
 * The index holds back-references only; the {@code EntityDirectory} owns the instances.
 */
public final class ComponentIndex {
    private final IComponentRegistry registry;
    private final Map<Class<?>, TypeBucket> buckets = new HashMap<>();

    private static final class TypeBucket {
        final LinkedHashMap<Integer, Component> entries = new LinkedHashMap<>();
        int modCount;
    }

    public ComponentIndex(IComponentRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public IComponentRegistry getRegistry() {
        return registry;
    }

    /**
     * Index {@code component} under its concrete type for {@code entityId}.
     *
     * @throws IllegalStateException if the entity already has an indexed component of that type
     */
    public void register(int entityId, Component component) {
        TypeBucket bucket = buckets.computeIfAbsent(component.getClass(), k -> new TypeBucket());
        Component existing = bucket.entries.get(entityId);
        if (existing != null) {
            throw new IllegalStateException("Entity " + entityId + " already indexed for " + component.getClass().getName());
        }
        bucket.entries.put(entityId, component);
        bucket.modCount++;
    }

    /**
     * Remove the index entry for ({@code entityId}, type of {@code component}) if it still
     * points at that exact instance.
     *
     * @return true if an entry was removed
     */
    public boolean unregister(int entityId, Component component) {
        TypeBucket bucket = buckets.get(component.getClass());
        if (bucket == null) return false;
        if (bucket.entries.get(entityId) != component) return false;
        bucket.entries.remove(entityId);
        bucket.modCount++;
        return true;
    }

    /**
     * Entities holding a live component of {@code type}, in attach order.
     */
    public Iterable<Integer> entitiesWith(Class<? extends Component> type) {
        return () -> new Iterator<>() {
            private final Iterator<? extends Component> delegate = iterator(type, false);

            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public Integer next() {
                return delegate.next().getOwner();
            }
        };
    }

    /**
     * Fail-fast iterator over the bucket of {@code type}.
     *
     * @param includePending also yield components that are pending removal
     */
    public <T extends Component> Iterator<T> iterator(Class<T> type, boolean includePending) {
        TypeBucket bucket = buckets.get(type);
        if (bucket == null) {
            return Collections.emptyIterator();
        }
        return new BucketIterator<>(bucket, type, includePending);
    }

    /**
     * Number of indexed entries for {@code type}, pending ones included.
     */
    public int indexedCount(Class<?> type) {
        TypeBucket bucket = buckets.get(type);
        return bucket == null ? 0 : bucket.entries.size();
    }

    /**
     * The indexed instance for ({@code entityId}, {@code type}) whatever its life stage, or null.
     */
    public Component indexed(int entityId, Class<?> type) {
        TypeBucket bucket = buckets.get(type);
        return bucket == null ? null : bucket.entries.get(entityId);
    }

    public Integer resolveNetworkId(Class<?> type) {
        return registry.getNetworkId(type);
    }

    /**
     * @throws UnknownNetworkIdException if {@code networkId} is not registered
     */
    public Class<? extends Component> resolveType(int networkId) {
        return registry.getType(networkId);
    }

    public Set<Class<? extends Component>> typesWithCapability(Class<?> capability) {
        return registry.getTypesWithCapability(capability);
    }

    private static final class BucketIterator<T extends Component> implements Iterator<T> {
        private final TypeBucket bucket;
        private final Class<T> type;
        private final boolean includePending;
        private final Iterator<Component> delegate;
        private final int expectedModCount;
        private T nextItem;

        BucketIterator(TypeBucket bucket, Class<T> type, boolean includePending) {
            this.bucket = bucket;
            this.type = type;
            this.includePending = includePending;
            this.delegate = bucket.entries.values().iterator();
            this.expectedModCount = bucket.modCount;
        }

        private boolean visible(Component c) {
            ComponentLifeStage stage = c.getLifeStage();
            return stage == ComponentLifeStage.ALIVE
                    || (includePending && stage == ComponentLifeStage.REMOVED_PENDING_CULL);
        }

        private void checkForComodification() {
            if (bucket.modCount != expectedModCount) {
                throw new ConcurrentModificationException(
                        "Component bucket " + type.getName() + " was structurally modified during iteration");
            }
        }

        @Override
        public boolean hasNext() {
            checkForComodification();
            if (nextItem != null && !visible(nextItem)) {
                nextItem = null;
            }
            while (nextItem == null && delegate.hasNext()) {
                Component candidate = delegate.next();
                if (visible(candidate)) {
                    nextItem = type.cast(candidate);
                }
            }
            return nextItem != null;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T result = nextItem;
            nextItem = null;
            return result;
        }
    }
}
