package com.ethnicthv.entitystore.core.components;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of a registered component type.
 *
 * @param type         the concrete component class
 * @param typeId       dense in-process id, assigned in registration order
 * @param name         registration name (see {@link Component.Name})
 * @param networkId    stable network id, or null if the type is not networked
 * @param capabilities supertypes the type can be queried by, excluding the type itself
 */
public record ComponentRegistration(Class<? extends Component> type,
                                    int typeId,
                                    String name,
                                    Integer networkId,
                                    Set<Class<?>> capabilities) {

    public ComponentRegistration {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        capabilities = Set.copyOf(capabilities);
    }

    public boolean isNetworked() {
        return networkId != null;
    }

    public boolean hasCapability(Class<?> capability) {
        return type == capability || capabilities.contains(capability);
    }
}
