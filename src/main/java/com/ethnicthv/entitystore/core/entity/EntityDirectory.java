package com.ethnicthv.entitystore.core.entity;

import com.ethnicthv.entitystore.core.ComponentAlreadyAttachedException;
import com.ethnicthv.entitystore.core.ComponentNotFoundException;
import com.ethnicthv.entitystore.core.InvalidEntityException;
import com.ethnicthv.entitystore.core.api.IComponentRegistry;
import com.ethnicthv.entitystore.core.api.IEventSink;
import com.ethnicthv.entitystore.core.components.Component;
import com.ethnicthv.entitystore.core.components.ComponentLifeStage;
import com.ethnicthv.entitystore.core.components.ComponentLifecycle;
import com.ethnicthv.entitystore.core.components.ComponentRegistration;
import com.ethnicthv.entitystore.core.event.ComponentAddedEvent;
import com.ethnicthv.entitystore.core.event.ComponentShutdownEvent;
import com.ethnicthv.entitystore.core.event.EntityDestroyedEvent;
import com.ethnicthv.entitystore.core.index.ComponentIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * EntityDirectory - owns every component instance, keyed by entity and concrete type.
 * <p>
 * Each (entity, type) slot holds at most one instance, either alive or pending removal. Every
 * attach and detach is mirrored into the {@link ComponentIndex}. {@link #cullComponent(Component)}
 * is the only way an instance leaves the directory.
 * <p>
 * Not thread-safe: all calls are expected on the simulation thread.
 */
public final class EntityDirectory {
    private static final Logger log = LoggerFactory.getLogger(EntityDirectory.class);

    private final ComponentIndex index;
    private final IComponentRegistry registry;
    private final IEventSink events;
    private final Map<Integer, EntityRecord> records = new LinkedHashMap<>();
    private final List<EntityDestructionListener> destructionListeners = new ArrayList<>();
    private int nextEntityId = 1;

    private static final class EntityRecord {
        final LinkedHashMap<Class<?>, Component> components = new LinkedHashMap<>();
        boolean terminating;
    }

    public EntityDirectory(ComponentIndex index, IEventSink events) {
        this.index = Objects.requireNonNull(index, "index");
        this.registry = index.getRegistry();
        this.events = Objects.requireNonNull(events, "events");
    }

    public ComponentIndex getIndex() {
        return index;
    }

    // =================================================================
    // Entity lifecycle hooks
    // =================================================================

    /**
     * Allocate a fresh entity id. Ids start at 1 and are never handed out twice.
     */
    public int createEntity() {
        while (records.containsKey(nextEntityId)) {
            nextEntityId++;
        }
        int entityId = nextEntityId++;
        records.put(entityId, new EntityRecord());
        return entityId;
    }

    /**
     * Make an id allocated by an external lifecycle source known to the directory.
     */
    public void registerEntity(int entityId) {
        if (entityId <= 0) {
            throw new IllegalArgumentException("entityId must be > 0, got " + entityId);
        }
        if (records.containsKey(entityId)) {
            throw new IllegalArgumentException("Entity " + entityId + " already exists");
        }
        records.put(entityId, new EntityRecord());
    }

    /**
     * True if the entity exists and is not being destroyed.
     */
    public boolean entityExists(int entityId) {
        EntityRecord record = records.get(entityId);
        return record != null && !record.terminating;
    }

    /**
     * True if the entity exists, including while it is being destroyed.
     */
    public boolean isKnown(int entityId) {
        return records.containsKey(entityId);
    }

    public int getEntityCount() {
        return records.size();
    }

    /**
     * Snapshot of all known entity ids in creation order.
     */
    public List<Integer> getEntities() {
        return Collections.unmodifiableList(new ArrayList<>(records.keySet()));
    }

    public void addDestructionListener(EntityDestructionListener listener) {
        destructionListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeDestructionListener(EntityDestructionListener listener) {
        destructionListeners.remove(listener);
    }

    /**
     * Shutdown hook for an entity: notifies destruction listeners, culls every component
     * (pending ones included), forgets the id and raises {@link EntityDestroyedEvent}.
     * Nothing about the entity remains in the directory or the index once this returns, even
     * when a listener or event handler fails. Such failures are rethrown after the purge, the
     * first one carrying the later ones as suppressed.
     *
     * @throws InvalidEntityException if the entity does not exist or is already being destroyed
     */
    public void destroyEntity(int entityId) {
        EntityRecord record = records.get(entityId);
        if (record == null || record.terminating) {
            throw new InvalidEntityException(entityId);
        }
        record.terminating = true;
        log.debug("Destroying entity {} with {} components", entityId, record.components.size());
        RuntimeException failure = null;
        for (EntityDestructionListener listener : new ArrayList<>(destructionListeners)) {
            try {
                listener.onEntityShutdown(entityId);
            } catch (RuntimeException ex) {
                failure = chain(failure, ex);
            }
        }
        // shutdown hooks cannot add components back (attach is refused while terminating)
        for (Component component : new ArrayList<>(record.components.values())) {
            try {
                cullComponent(component);
            } catch (RuntimeException ex) {
                failure = chain(failure, ex);
            }
        }
        records.remove(entityId);
        try {
            events.raiseLocalEvent(entityId, new EntityDestroyedEvent(entityId));
        } catch (RuntimeException ex) {
            failure = chain(failure, ex);
        }
        if (failure != null) {
            log.warn("Entity {} destroyed with failing shutdown handlers", entityId);
            throw failure;
        }
    }

    private static RuntimeException chain(RuntimeException first, RuntimeException next) {
        if (first == null) {
            return next;
        }
        if (first != next) {
            first.addSuppressed(next);
        }
        return first;
    }

    // =================================================================
    // Attach / lookup
    // =================================================================

    /**
     * Attach {@code component} to {@code entityId}.
     * <p>
     * A live component of the same type is replaced only if {@code overwrite} is set; the
     * displaced instance is culled immediately (its shutdown runs once). A component of the same
     * type that is still pending removal is culled immediately as well.
     * <p>
     * The new instance is in place before any hook or handler runs. If the displaced instance's
     * shutdown or an event handler fails, the attach still stands and the failure is rethrown.
     *
     * @throws InvalidEntityException            if the entity does not exist
     * @throws ComponentAlreadyAttachedException if a live component of the type exists and overwrite is false
     * @throws IllegalArgumentException          if the type is not registered or the instance belongs to another entity
     * @throws IllegalStateException             if the instance is already attached or was culled
     */
    public <T extends Component> T attach(int entityId, T component, boolean overwrite) {
        Objects.requireNonNull(component, "component");
        EntityRecord record = records.get(entityId);
        if (record == null || record.terminating) {
            throw new InvalidEntityException(entityId);
        }
        Class<? extends Component> type = component.getClass();
        if (!registry.isRegistered(type)) {
            throw new IllegalArgumentException("Component type " + type.getName() + " not registered");
        }
        ComponentLifecycle.checkAttachable(component, entityId);

        Component existing = record.components.get(type);
        if (existing != null && existing.isAlive() && !overwrite) {
            throw new ComponentAlreadyAttachedException(entityId, type);
        }

        // validation done; swap the slot before any user code runs
        if (existing != null) {
            log.debug("Entity {}: displacing {} ({})", entityId, type.getSimpleName(), existing.getLifeStage());
            index.unregister(entityId, existing);
        }
        ComponentLifecycle.attach(component, entityId);
        record.components.put(type, component);
        index.register(entityId, component);
        log.debug("Entity {}: attached {}", entityId, type.getSimpleName());

        RuntimeException failure = null;
        if (existing != null) {
            try {
                shutdownDetached(entityId, existing);
            } catch (RuntimeException ex) {
                failure = ex;
            }
        }
        try {
            ComponentLifecycle.notifyAdded(component);
            events.raiseLocalEvent(entityId, new ComponentAddedEvent(entityId, component));
        } catch (RuntimeException ex) {
            failure = chain(failure, ex);
        }
        if (failure != null) {
            throw failure;
        }
        return component;
    }

    /**
     * @throws InvalidEntityException     if the entity does not exist
     * @throws ComponentNotFoundException if no live component of that type is attached
     */
    public <T extends Component> T get(int entityId, Class<T> type) {
        EntityRecord record = records.get(entityId);
        if (record == null) {
            throw new InvalidEntityException(entityId);
        }
        Component component = record.components.get(type);
        if (component == null || !component.isAlive()) {
            throw new ComponentNotFoundException(entityId, type);
        }
        return type.cast(component);
    }

    /**
     * Non-failing variant of {@link #get(int, Class)}.
     *
     * @return the live component, or null if the entity or the component is absent
     */
    public <T extends Component> T tryGet(int entityId, Class<T> type) {
        EntityRecord record = records.get(entityId);
        if (record == null) return null;
        Component component = record.components.get(type);
        if (component == null || !component.isAlive()) return null;
        return type.cast(component);
    }

    /**
     * @throws com.ethnicthv.entitystore.core.UnknownNetworkIdException if {@code networkId} is not registered
     */
    public Component get(int entityId, int networkId) {
        return get(entityId, index.resolveType(networkId));
    }

    /**
     * @throws com.ethnicthv.entitystore.core.UnknownNetworkIdException if {@code networkId} is not registered
     */
    public Component tryGet(int entityId, int networkId) {
        return tryGet(entityId, index.resolveType(networkId));
    }

    /**
     * The component in the (entity, type) slot whatever its life stage, or null.
     */
    public Component peek(int entityId, Class<?> type) {
        EntityRecord record = records.get(entityId);
        return record == null ? null : record.components.get(type);
    }

    /**
     * Lazy, restartable view of the live components of an entity in attach order.
     *
     * @throws InvalidEntityException if the entity does not exist
     */
    public Iterable<Component> enumerate(int entityId) {
        EntityRecord record = requireRecord(entityId);
        return () -> new FilteringIterator<>(record.components.values().iterator(), Component::isAlive, Component.class);
    }

    /**
     * Live components of an entity whose registration declares {@code capability}. Each
     * component appears once, whatever its concrete type.
     *
     * @throws InvalidEntityException if the entity does not exist
     */
    public <C> Iterable<C> enumerateByCapability(int entityId, Class<C> capability) {
        Objects.requireNonNull(capability, "capability");
        EntityRecord record = requireRecord(entityId);
        Predicate<Component> matches = c -> {
            if (!c.isAlive()) return false;
            ComponentRegistration registration = registry.getRegistration(c.getClass());
            return registration != null && registration.hasCapability(capability);
        };
        return () -> new FilteringIterator<>(record.components.values().iterator(), matches, capability);
    }

    // =================================================================
    // Final detachment
    // =================================================================

    /**
     * Detach {@code component} from its owner and the index, move it to CULLED, run its shutdown
     * hook and raise {@link ComponentShutdownEvent}. Culling an instance twice is a no-op.
     *
     * @return true if this call culled the component
     */
    public boolean cullComponent(Component component) {
        if (component.getLifeStage() == ComponentLifeStage.CREATED) {
            return false;
        }
        int owner = component.getOwner();
        EntityRecord record = records.get(owner);
        if (record != null && record.components.get(component.getClass()) == component) {
            record.components.remove(component.getClass());
        }
        index.unregister(owner, component);
        return shutdownDetached(owner, component);
    }

    private boolean shutdownDetached(int owner, Component component) {
        if (!ComponentLifecycle.shutdown(component)) {
            return false;
        }
        events.raiseLocalEvent(owner, new ComponentShutdownEvent(owner, component));
        return true;
    }

    private EntityRecord requireRecord(int entityId) {
        EntityRecord record = records.get(entityId);
        if (record == null) {
            throw new InvalidEntityException(entityId);
        }
        return record;
    }

    private static final class FilteringIterator<C> implements Iterator<C> {
        private final Iterator<Component> delegate;
        private final Predicate<Component> filter;
        private final Class<C> view;
        private Component nextItem;

        FilteringIterator(Iterator<Component> delegate, Predicate<Component> filter, Class<C> view) {
            this.delegate = delegate;
            this.filter = filter;
            this.view = view;
        }

        @Override
        public boolean hasNext() {
            if (nextItem != null && !filter.test(nextItem)) {
                nextItem = null;
            }
            while (nextItem == null && delegate.hasNext()) {
                Component candidate = delegate.next();
                if (filter.test(candidate)) {
                    nextItem = candidate;
                }
            }
            return nextItem != null;
        }

        @Override
        public C next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Component result = nextItem;
            nextItem = null;
            return view.cast(result);
        }
    }
}
