package com.ethnicthv.entitystore.core.api;

import com.ethnicthv.entitystore.core.UnknownNetworkIdException;
import com.ethnicthv.entitystore.core.components.Component;
import com.ethnicthv.entitystore.core.components.ComponentRegistration;

import java.util.Set;

/**
 * Read-only view of the component type registry consumed by the store.
 * <p>
 * Implementations must not renumber network ids or change capabilities once the store is
 * live; the store caches nothing but relies on answers being stable.
 */
public interface IComponentRegistry {

    /**
     * @return the registration for {@code componentClass}, or null if it was never registered
     */
    ComponentRegistration getRegistration(Class<?> componentClass);

    /**
     * @return the registration with the given name, or null if none
     */
    ComponentRegistration getRegistration(String name);

    /**
     * Check whether a component type is registered.
     */
    boolean isRegistered(Class<?> componentClass);

    /**
     * Resolve a component type to its network id.
     *
     * @return the network id, or null if the type is unregistered or not networked
     */
    Integer getNetworkId(Class<?> componentClass);

    /**
     * Resolve a network id to its component type.
     *
     * @throws UnknownNetworkIdException if no type carries that id
     */
    Class<? extends Component> getType(int networkId);

    /**
     * Capabilities declared by a registered type: every interface it implements and every
     * abstract or concrete supertype between it and {@link Component}.
     *
     * @return an unmodifiable set, empty for unregistered types
     */
    Set<Class<?>> getCapabilities(Class<?> componentClass);

    /**
     * Registered concrete types that declare {@code capability}, in registration order.
     * A concrete type is considered to declare itself.
     */
    Set<Class<? extends Component>> getTypesWithCapability(Class<?> capability);
}
