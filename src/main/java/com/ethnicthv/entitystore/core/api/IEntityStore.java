package com.ethnicthv.entitystore.core.api;

import com.ethnicthv.entitystore.core.ComponentAlreadyAttachedException;
import com.ethnicthv.entitystore.core.ComponentNotFoundException;
import com.ethnicthv.entitystore.core.InvalidEntityException;
import com.ethnicthv.entitystore.core.UnknownNetworkIdException;
import com.ethnicthv.entitystore.core.components.Component;
import com.ethnicthv.entitystore.core.query.ComponentEntry;
import com.ethnicthv.entitystore.core.view.SubscriptionLedger;

/**
 * Public API of the entity component store.
 * <p>
 * All methods must be called from the simulation thread.
 */
public interface IEntityStore extends AutoCloseable {

    // ---- entities ----

    /**
     * Create a new entity with no components.
     *
     * @return The unique ID of the newly created entity.
     */
    int createEntity();

    /**
     * Adopt an entity id allocated elsewhere.
     */
    void registerEntity(int entityId);

    boolean entityExists(int entityId);

    /**
     * Destroy an entity: drop its view subscriptions, cull all its components, forget the id.
     *
     * @throws InvalidEntityException if the entity does not exist
     */
    void destroyEntity(int entityId);

    int getEntityCount();

    // ---- components ----

    /**
     * Attach a component; fails if a live one of the same type is attached.
     *
     * @throws ComponentAlreadyAttachedException if a live component of the type exists
     * @throws InvalidEntityException            if the entity does not exist
     */
    <T extends Component> T addComponent(int entityId, T component);

    /**
     * Attach a component, replacing a live one of the same type if {@code overwrite} is set.
     */
    <T extends Component> T addComponent(int entityId, T component, boolean overwrite);

    /**
     * @throws ComponentNotFoundException if no live component of that type is attached
     */
    <T extends Component> T getComponent(int entityId, Class<T> componentClass);

    /**
     * @throws UnknownNetworkIdException  if the id is not registered
     * @throws ComponentNotFoundException if no live component of that type is attached
     */
    Component getComponent(int entityId, int networkId);

    /**
     * @return the live component, or null if absent
     */
    <T extends Component> T tryGetComponent(int entityId, Class<T> componentClass);

    /**
     * @return the live component, or null if absent
     * @throws UnknownNetworkIdException if the id is not registered
     */
    Component tryGetComponent(int entityId, int networkId);

    boolean hasComponent(int entityId, Class<? extends Component> componentClass);

    /**
     * @throws UnknownNetworkIdException if the id is not registered
     */
    boolean hasComponent(int entityId, int networkId);

    /**
     * Mark a component for removal. It becomes invisible immediately and is detached at the next
     * {@link #cullRemovedComponents()}.
     *
     * @return false if there was no live component to remove
     */
    boolean removeComponent(int entityId, Class<? extends Component> componentClass);

    /**
     * @throws UnknownNetworkIdException if the id is not registered
     */
    boolean removeComponent(int entityId, int networkId);

    boolean removeComponent(Component component);

    /**
     * Finalize all pending removals.
     *
     * @return number of components culled
     */
    int cullRemovedComponents();

    /**
     * Live components of one entity.
     */
    Iterable<Component> getComponents(int entityId);

    /**
     * Live components of one entity that declare {@code capability}.
     */
    <C> Iterable<C> getComponents(int entityId, Class<C> capability);

    // ---- queries ----

    /**
     * Live components of a type across all entities, in attach order.
     */
    <T extends Component> Iterable<T> entityQuery(Class<T> componentClass);

    <T extends Component> Iterable<ComponentEntry<T>> query(Class<T> componentClass, boolean includePending);

    <C> Iterable<C> queryByCapability(Class<C> capability);

    Iterable<Integer> entitiesWith(Class<? extends Component> componentClass);

    // ---- collaborators ----

    IComponentRegistry getRegistry();

    /**
     * Create a view-subscription ledger wired to this store's entity destruction.
     */
    <S> SubscriptionLedger<S> newSubscriptionLedger();

    /**
     * Destroy all entities and dispose systems.
     */
    @Override
    void close();
}
