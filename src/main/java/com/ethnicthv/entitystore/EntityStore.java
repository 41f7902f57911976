package com.ethnicthv.entitystore;

import com.ethnicthv.entitystore.core.api.IComponentRegistry;
import com.ethnicthv.entitystore.core.api.IEntityStore;
import com.ethnicthv.entitystore.core.api.IEventSink;
import com.ethnicthv.entitystore.core.components.Component;
import com.ethnicthv.entitystore.core.components.ComponentRegistry;
import com.ethnicthv.entitystore.core.entity.EntityDirectory;
import com.ethnicthv.entitystore.core.event.EventBus;
import com.ethnicthv.entitystore.core.index.ComponentIndex;
import com.ethnicthv.entitystore.core.query.ComponentEntry;
import com.ethnicthv.entitystore.core.query.QueryEngine;
import com.ethnicthv.entitystore.core.removal.RemovalQueue;
import com.ethnicthv.entitystore.core.system.ISystem;
import com.ethnicthv.entitystore.core.system.SystemGroup;
import com.ethnicthv.entitystore.core.system.SystemManager;
import com.ethnicthv.entitystore.core.view.SubscriptionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * EntityStore - the single entry point (Facade) for the entity component store.
 * <p>
 * Wires the {@link EntityDirectory}, {@link ComponentIndex}, {@link RemovalQueue} and
 * {@link QueryEngine} together and runs systems through a {@link SystemManager}.
 * Use {@link #builder()} to configure and create one.
 * <p>
 * Example:
 * <pre>{@code
 * EntityStore store = EntityStore.builder()
 *         .registerComponent(PositionComponent.class)
 *         .registerComponent(HealthComponent.class, 7)
 *         .build();
 * int e = store.createEntity();
 * store.addComponent(e, new PositionComponent());
 * store.removeComponent(e, PositionComponent.class); // invisible from now on
 * store.cullRemovedComponents();                    // detached and shut down
 * }</pre>
 */
public final class EntityStore implements IEntityStore {
    private static final Logger log = LoggerFactory.getLogger(EntityStore.class);

    private final ComponentRegistry registry;
    private final IEventSink events;
    private final ComponentIndex index;
    private final EntityDirectory directory;
    private final RemovalQueue removals;
    private final QueryEngine queries;
    private final SystemManager systemManager;

    // Private constructor, use EntityStore.builder() instead.
    private EntityStore(ComponentRegistry registry, IEventSink events, boolean cullOnUpdate) {
        this.registry = registry;
        this.events = events;
        this.index = new ComponentIndex(registry);
        this.directory = new EntityDirectory(index, events);
        this.removals = new RemovalQueue(directory);
        this.queries = new QueryEngine(directory);
        this.directory.addDestructionListener(removals);
        this.systemManager = new SystemManager(this, cullOnUpdate);
    }

    /**
     * Create a new Builder instance to configure the store.
     */
    public static Builder builder() {
        return new Builder();
    }

    // =================================================================
    // Entities
    // =================================================================

    @Override
    public int createEntity() {
        return directory.createEntity();
    }

    @Override
    public void registerEntity(int entityId) {
        directory.registerEntity(entityId);
    }

    @Override
    public boolean entityExists(int entityId) {
        return directory.entityExists(entityId);
    }

    @Override
    public void destroyEntity(int entityId) {
        directory.destroyEntity(entityId);
    }

    @Override
    public int getEntityCount() {
        return directory.getEntityCount();
    }

    // =================================================================
    // Components
    // =================================================================

    @Override
    public <T extends Component> T addComponent(int entityId, T component) {
        return directory.attach(entityId, component, false);
    }

    @Override
    public <T extends Component> T addComponent(int entityId, T component, boolean overwrite) {
        return directory.attach(entityId, component, overwrite);
    }

    @Override
    public <T extends Component> T getComponent(int entityId, Class<T> componentClass) {
        return directory.get(entityId, componentClass);
    }

    @Override
    public Component getComponent(int entityId, int networkId) {
        return directory.get(entityId, networkId);
    }

    @Override
    public <T extends Component> T tryGetComponent(int entityId, Class<T> componentClass) {
        return directory.tryGet(entityId, componentClass);
    }

    @Override
    public Component tryGetComponent(int entityId, int networkId) {
        return directory.tryGet(entityId, networkId);
    }

    @Override
    public boolean hasComponent(int entityId, Class<? extends Component> componentClass) {
        return queries.has(entityId, componentClass);
    }

    @Override
    public boolean hasComponent(int entityId, int networkId) {
        return queries.has(entityId, networkId);
    }

    @Override
    public boolean removeComponent(int entityId, Class<? extends Component> componentClass) {
        return removals.markRemoved(entityId, componentClass);
    }

    @Override
    public boolean removeComponent(int entityId, int networkId) {
        return removals.markRemoved(entityId, networkId);
    }

    @Override
    public boolean removeComponent(Component component) {
        return removals.markRemoved(component);
    }

    @Override
    public int cullRemovedComponents() {
        return removals.cull();
    }

    @Override
    public Iterable<Component> getComponents(int entityId) {
        return directory.enumerate(entityId);
    }

    @Override
    public <C> Iterable<C> getComponents(int entityId, Class<C> capability) {
        return directory.enumerateByCapability(entityId, capability);
    }

    // =================================================================
    // Queries
    // =================================================================

    @Override
    public <T extends Component> Iterable<T> entityQuery(Class<T> componentClass) {
        return queries.components(componentClass);
    }

    @Override
    public <T extends Component> Iterable<ComponentEntry<T>> query(Class<T> componentClass, boolean includePending) {
        return queries.query(componentClass, includePending);
    }

    @Override
    public <C> Iterable<C> queryByCapability(Class<C> capability) {
        return queries.queryByCapability(capability);
    }

    @Override
    public Iterable<Integer> entitiesWith(Class<? extends Component> componentClass) {
        return queries.entitiesWith(componentClass);
    }

    // =================================================================
    // Collaborators
    // =================================================================

    @Override
    public IComponentRegistry getRegistry() {
        return registry;
    }

    public IEventSink getEventSink() {
        return events;
    }

    public QueryEngine getQueryEngine() {
        return queries;
    }

    public RemovalQueue getRemovalQueue() {
        return removals;
    }

    public EntityDirectory getDirectory() {
        return directory;
    }

    public SystemManager getSystemManager() {
        return systemManager;
    }

    @Override
    public <S> SubscriptionLedger<S> newSubscriptionLedger() {
        SubscriptionLedger<S> ledger = new SubscriptionLedger<>(directory, events);
        directory.addDestructionListener(ledger);
        return ledger;
    }

    /**
     * Run one tick of all registered systems, followed by the cull point unless disabled in
     * the builder.
     */
    public void update(float deltaTime) {
        systemManager.update(deltaTime);
    }

    /**
     * Dispose systems, destroy every entity and finalize pending removals.
     */
    @Override
    public void close() {
        systemManager.dispose();
        for (int entityId : directory.getEntities()) {
            if (directory.entityExists(entityId)) {
                directory.destroyEntity(entityId);
            }
        }
        removals.cull();
        log.debug("Entity store closed");
    }

    // =================================================================
    // Builder Implementation
    // =================================================================

    public static class Builder {
        private ComponentRegistry registry;
        private final List<Class<? extends Component>> components = new ArrayList<>();
        private final List<NetworkedRegistration> networkedComponents = new ArrayList<>();
        private final List<SystemRegistration> systems = new ArrayList<>();
        private IEventSink eventSink;
        private boolean cullOnUpdate = true;

        record SystemRegistration(ISystem system, SystemGroup group) {}

        record NetworkedRegistration(Class<? extends Component> type, int networkId) {}

        /**
         * Use an existing registry instead of a fresh one. It is frozen by {@link #build()}.
         */
        public Builder registry(ComponentRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Register a component type; its network id comes from {@link Component.Networked}, if any.
         */
        public Builder registerComponent(Class<? extends Component> componentClass) {
            components.add(componentClass);
            return this;
        }

        /**
         * Register a networked component type with an explicit network id.
         */
        public Builder registerComponent(Class<? extends Component> componentClass, int networkId) {
            networkedComponents.add(new NetworkedRegistration(componentClass, networkId));
            return this;
        }

        /**
         * Route store notifications to {@code sink} instead of a fresh {@link EventBus}.
         */
        public Builder eventSink(IEventSink sink) {
            this.eventSink = sink;
            return this;
        }

        /**
         * Whether {@link EntityStore#update(float)} culls removed components at the end of each
         * tick. Defaults to true.
         */
        public Builder cullOnUpdate(boolean cullOnUpdate) {
            this.cullOnUpdate = cullOnUpdate;
            return this;
        }

        /**
         * Add a System instance to the default SIMULATION group.
         */
        public Builder addSystem(ISystem system) {
            systems.add(new SystemRegistration(system, SystemGroup.SIMULATION));
            return this;
        }

        /**
         * Add a System instance to a specific execution group.
         */
        public Builder addSystem(ISystem system, SystemGroup group) {
            systems.add(new SystemRegistration(system, group));
            return this;
        }

        /**
         * Build the store.
         * This will:
         * 1. Register components (explicit network ids first) and freeze the registry.
         * 2. Create the directory, index, removal queue and query engine.
         * 3. Register all added systems.
         */
        public EntityStore build() {
            ComponentRegistry reg = registry != null ? registry : new ComponentRegistry();
            // explicit ids first (builder, then annotation) so auto-assigned ids never collide with them
            for (NetworkedRegistration nr : networkedComponents) {
                reg.registerComponent(nr.type(), nr.networkId());
            }
            List<Class<? extends Component>> autoIds = new ArrayList<>();
            for (Class<? extends Component> type : components) {
                Component.Networked networked = type.getAnnotation(Component.Networked.class);
                if (networked != null && networked.id() >= 0) {
                    reg.registerComponent(type);
                } else {
                    autoIds.add(type);
                }
            }
            for (Class<? extends Component> type : autoIds) {
                reg.registerComponent(type);
            }
            reg.freeze();

            IEventSink sink = eventSink != null ? eventSink : new EventBus();
            EntityStore store = new EntityStore(reg, sink, cullOnUpdate);

            for (SystemRegistration sr : systems) {
                try {
                    store.systemManager.registerSystem(sr.system(), sr.group());
                } catch (RuntimeException ex) {
                    throw new IllegalStateException("Failed to register system " + sr.system().getClass().getName(), ex);
                }
            }

            log.info("Entity store built: {} component types, {} systems, cullOnUpdate={}",
                    reg.getRegistrations().size(), systems.size(), cullOnUpdate);
            return store;
        }
    }
}
