package com.ethnicthv.entitystore.core.query;

import com.ethnicthv.entitystore.core.components.Component;
import com.ethnicthv.entitystore.core.entity.EntityDirectory;
import com.ethnicthv.entitystore.core.index.ComponentIndex;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * QueryEngine - read-only traversal over the component index.
 * <p>
 * Every sequence returned here is lazy and restartable; each call to {@code iterator()} walks
 * the index again and sees the state at that time. Live queries never return components that
 * are pending removal or culled.
 * <p>
 * <strong>Precondition:</strong> do not attach or cull components of a type while iterating that
 * type. The iterator fails with {@link java.util.ConcurrentModificationException}. Marking
 * components for removal during iteration is allowed and takes effect immediately.
 */
public final class QueryEngine {
    private final EntityDirectory directory;
    private final ComponentIndex index;

    public QueryEngine(EntityDirectory directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.index = directory.getIndex();
    }

    /**
     * All live components of {@code type} with their owners, in attach order.
     */
    public <T extends Component> Iterable<ComponentEntry<T>> query(Class<T> type) {
        return query(type, false);
    }

    /**
     * @param includePending also return components pending removal; for maintenance code only
     */
    public <T extends Component> Iterable<ComponentEntry<T>> query(Class<T> type, boolean includePending) {
        Objects.requireNonNull(type, "type");
        return () -> new Iterator<>() {
            private final Iterator<T> delegate = index.iterator(type, includePending);

            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public ComponentEntry<T> next() {
                T component = delegate.next();
                return new ComponentEntry<>(type, component.getOwner(), component);
            }
        };
    }

    /**
     * All live components of {@code type}, in attach order.
     */
    public <T extends Component> Iterable<T> components(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return () -> index.iterator(type, false);
    }

    /**
     * Visit every live component of {@code type} with its owner.
     */
    public <T extends Component> void forEach(Class<T> type, BiConsumer<Integer, T> consumer) {
        Iterator<T> it = index.iterator(type, false);
        while (it.hasNext()) {
            T component = it.next();
            consumer.accept(component.getOwner(), component);
        }
    }

    /**
     * Live components of every registered concrete type declaring {@code capability}.
     * Each component is returned exactly once. Types are visited in registration order.
     */
    public <C> Iterable<C> queryByCapability(Class<C> capability) {
        Objects.requireNonNull(capability, "capability");
        return () -> new Iterator<>() {
            private final Iterator<Class<? extends Component>> types = index.typesWithCapability(capability).iterator();
            private Iterator<? extends Component> current = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!current.hasNext()) {
                    if (!types.hasNext()) {
                        return false;
                    }
                    current = index.iterator(types.next(), false);
                }
                return true;
            }

            @Override
            public C next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return capability.cast(current.next());
            }
        };
    }

    /**
     * Entities holding a live component of {@code type}.
     */
    public Iterable<Integer> entitiesWith(Class<? extends Component> type) {
        return index.entitiesWith(type);
    }

    /**
     * Number of live components of {@code type}.
     */
    public int count(Class<? extends Component> type) {
        int n = 0;
        for (Integer ignored : index.entitiesWith(type)) {
            n++;
        }
        return n;
    }

    /**
     * True iff a live component of {@code type} is attached; false for pending, absent, or
     * unknown entities.
     */
    public boolean has(int entityId, Class<? extends Component> type) {
        Component component = directory.peek(entityId, type);
        return component != null && component.isAlive();
    }

    /**
     * @throws com.ethnicthv.entitystore.core.UnknownNetworkIdException if {@code networkId} is not registered
     */
    public boolean has(int entityId, int networkId) {
        return has(entityId, index.resolveType(networkId));
    }
}
