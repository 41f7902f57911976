package com.ethnicthv.entitystore.core.components;

import com.ethnicthv.entitystore.core.UnknownNetworkIdException;
import com.ethnicthv.entitystore.core.api.IComponentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ComponentRegistry - registers component types and answers type, name and network id lookups.
 * <p>
 * Capabilities are computed once per type at registration time by walking its supertypes, so
 * capability queries never inspect component instances at runtime.
 * Once {@link #freeze()} is called, no more types can be registered and all ids are final.
 */
public class ComponentRegistry implements IComponentRegistry {
    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    private final ConcurrentHashMap<Class<?>, ComponentRegistration> registrations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ComponentRegistration> byName = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, Class<? extends Component>> byNetworkId = new ConcurrentHashMap<>();
    // capability -> concrete types, in registration order
    private final Map<Class<?>, Set<Class<? extends Component>>> capabilityIndex = new ConcurrentHashMap<>();
    private final AtomicInteger nextTypeId = new AtomicInteger(0);
    private int nextAutoNetworkId = 0;
    private volatile boolean frozen = false;

    /**
     * Register a component class. The network id is taken from {@link Component.Networked} if
     * present. Registering the same class again returns the existing type id.
     *
     * @return the type id
     */
    public synchronized int registerComponent(Class<? extends Component> componentClass) {
        ComponentRegistration existing = registrations.get(componentClass);
        if (existing != null) {
            return existing.typeId();
        }
        Integer networkId = null;
        Component.Networked networked = componentClass.getAnnotation(Component.Networked.class);
        if (networked != null) {
            networkId = networked.id() >= 0 ? networked.id() : nextFreeNetworkId();
        }
        return register(componentClass, networkId);
    }

    /**
     * Register a component class with an explicit network id, overriding any annotation.
     *
     * @return the type id
     */
    public synchronized int registerComponent(Class<? extends Component> componentClass, int networkId) {
        if (networkId < 0) {
            throw new IllegalArgumentException("networkId must be >= 0, got " + networkId);
        }
        ComponentRegistration existing = registrations.get(componentClass);
        if (existing != null) {
            if (!Integer.valueOf(networkId).equals(existing.networkId())) {
                throw new IllegalArgumentException("Component " + componentClass.getName()
                        + " is already registered with network id " + existing.networkId());
            }
            return existing.typeId();
        }
        return register(componentClass, networkId);
    }

    private int register(Class<? extends Component> componentClass, Integer networkId) {
        if (frozen) {
            throw new IllegalStateException("Registry is frozen; cannot register " + componentClass.getName());
        }
        validateComponentClass(componentClass);

        String name = nameOf(componentClass);
        if (byName.containsKey(name)) {
            throw new IllegalArgumentException("Component name '" + name + "' of " + componentClass.getName()
                    + " is already used by " + byName.get(name).type().getName());
        }
        if (networkId != null && byNetworkId.containsKey(networkId)) {
            throw new IllegalArgumentException("Network id " + networkId + " of " + componentClass.getName()
                    + " is already used by " + byNetworkId.get(networkId).getName());
        }

        Set<Class<?>> capabilities = collectCapabilities(componentClass);
        int typeId = nextTypeId.getAndIncrement();
        ComponentRegistration registration = new ComponentRegistration(componentClass, typeId, name, networkId, capabilities);

        registrations.put(componentClass, registration);
        byName.put(name, registration);
        if (networkId != null) {
            byNetworkId.put(networkId, componentClass);
        }
        capabilityIndex.computeIfAbsent(componentClass, k -> Collections.synchronizedSet(new LinkedHashSet<>())).add(componentClass);
        for (Class<?> capability : capabilities) {
            capabilityIndex.computeIfAbsent(capability, k -> Collections.synchronizedSet(new LinkedHashSet<>())).add(componentClass);
        }

        log.debug("Registered component {} as '{}' (typeId={}, netId={}, capabilities={})",
                componentClass.getName(), name, typeId, networkId, capabilities.size());
        return typeId;
    }

    /**
     * Stop accepting registrations. Idempotent.
     */
    public void freeze() {
        if (!frozen) {
            frozen = true;
            log.debug("Component registry frozen with {} types", registrations.size());
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    @Override
    public ComponentRegistration getRegistration(Class<?> componentClass) {
        return registrations.get(componentClass);
    }

    @Override
    public ComponentRegistration getRegistration(String name) {
        return name == null ? null : byName.get(name);
    }

    @Override
    public boolean isRegistered(Class<?> componentClass) {
        return registrations.containsKey(componentClass);
    }

    /**
     * Get component type ID, or null if not registered
     */
    public Integer getTypeId(Class<?> componentClass) {
        ComponentRegistration registration = registrations.get(componentClass);
        return registration != null ? registration.typeId() : null;
    }

    @Override
    public Integer getNetworkId(Class<?> componentClass) {
        ComponentRegistration registration = registrations.get(componentClass);
        return registration != null ? registration.networkId() : null;
    }

    @Override
    public Class<? extends Component> getType(int networkId) {
        Class<? extends Component> type = byNetworkId.get(networkId);
        if (type == null) {
            throw new UnknownNetworkIdException(networkId);
        }
        return type;
    }

    @Override
    public Set<Class<?>> getCapabilities(Class<?> componentClass) {
        ComponentRegistration registration = registrations.get(componentClass);
        return registration != null ? registration.capabilities() : Set.of();
    }

    @Override
    public Set<Class<? extends Component>> getTypesWithCapability(Class<?> capability) {
        Set<Class<? extends Component>> types = capabilityIndex.get(capability);
        if (types == null) {
            return Set.of();
        }
        synchronized (types) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(types));
        }
    }

    /**
     * Get all registered component registrations
     */
    public Collection<ComponentRegistration> getRegistrations() {
        return Collections.unmodifiableCollection(registrations.values());
    }

    private int nextFreeNetworkId() {
        while (byNetworkId.containsKey(nextAutoNetworkId)) {
            nextAutoNetworkId++;
        }
        return nextAutoNetworkId++;
    }

    private static String nameOf(Class<?> componentClass) {
        Component.Name annotation = componentClass.getAnnotation(Component.Name.class);
        if (annotation != null) {
            if (annotation.value().isBlank()) {
                throw new IllegalArgumentException("@Component.Name must not be blank on " + componentClass.getName());
            }
            return annotation.value();
        }
        String simple = componentClass.getSimpleName();
        if (simple.endsWith("Component") && simple.length() > "Component".length()) {
            return simple.substring(0, simple.length() - "Component".length());
        }
        return simple;
    }

    /**
     * Walk superclasses up to (excluding) {@link Component} and all interfaces transitively.
     */
    private static Set<Class<?>> collectCapabilities(Class<?> componentClass) {
        Set<Class<?>> result = new LinkedHashSet<>();
        Deque<Class<?>> pending = new ArrayDeque<>();
        pending.push(componentClass);
        while (!pending.isEmpty()) {
            Class<?> current = pending.pop();
            Class<?> superclass = current.getSuperclass();
            if (superclass != null && superclass != Component.class && superclass != Object.class) {
                if (result.add(superclass)) {
                    pending.push(superclass);
                }
            }
            for (Class<?> itf : current.getInterfaces()) {
                if (result.add(itf)) {
                    pending.push(itf);
                }
            }
        }
        return result;
    }

    private static void validateComponentClass(Class<?> componentClass) {
        if (componentClass == null) {
            throw new IllegalArgumentException("componentClass must not be null");
        }
        if (!Component.class.isAssignableFrom(componentClass)) {
            throw new IllegalArgumentException(componentClass.getName() + " must extend Component");
        }
        if (componentClass.isInterface() || Modifier.isAbstract(componentClass.getModifiers())) {
            throw new IllegalArgumentException("Only concrete component classes can be registered: " + componentClass.getName());
        }
    }
}
