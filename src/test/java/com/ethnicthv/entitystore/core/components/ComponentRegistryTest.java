package com.ethnicthv.entitystore.core.components;

import com.ethnicthv.entitystore.TestComponents.ArmorBase;
import com.ethnicthv.entitystore.TestComponents.ArmorComponent;
import com.ethnicthv.entitystore.TestComponents.DummyComponent;
import com.ethnicthv.entitystore.TestComponents.HealthComponent;
import com.ethnicthv.entitystore.TestComponents.ICompType1;
import com.ethnicthv.entitystore.TestComponents.ICompType2;
import com.ethnicthv.entitystore.TestComponents.IDamageable;
import com.ethnicthv.entitystore.TestComponents.PositionComponent;
import com.ethnicthv.entitystore.core.UnknownNetworkIdException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ComponentRegistryTest {

    @Component.Name("Dummy")
    static class ClashingNameComponent extends Component {
    }

    @Component.Networked(id = 3)
    static class FixedIdComponent extends Component {
    }

    @Test
    void registersNameNetworkIdAndCapabilities() {
        ComponentRegistry registry = new ComponentRegistry();
        int typeId = registry.registerComponent(DummyComponent.class);

        ComponentRegistration reg = registry.getRegistration(DummyComponent.class);
        assertNotNull(reg);
        assertEquals(typeId, reg.typeId());
        assertEquals("Dummy", reg.name());
        assertTrue(reg.isNetworked());
        assertEquals(0, reg.networkId());
        assertEquals(Set.of(ICompType1.class, ICompType2.class), reg.capabilities());
        assertSame(reg, registry.getRegistration("Dummy"));
        assertEquals(DummyComponent.class, registry.getType(0));
    }

    @Test
    void registeringTwiceIsIdempotent() {
        ComponentRegistry registry = new ComponentRegistry();
        int first = registry.registerComponent(HealthComponent.class);
        int second = registry.registerComponent(HealthComponent.class);
        assertEquals(first, second);
        assertEquals(1, registry.getRegistrations().size());
    }

    @Test
    void defaultNameStripsComponentSuffix() {
        ComponentRegistry registry = new ComponentRegistry();
        registry.registerComponent(HealthComponent.class);
        assertEquals("Health", registry.getRegistration(HealthComponent.class).name());
        assertNull(registry.getNetworkId(HealthComponent.class), "Non-networked type has no network id");
        assertFalse(registry.getRegistration(HealthComponent.class).isNetworked());
    }

    @Test
    void explicitNetworkIdsAndAutoAssignmentDoNotCollide() {
        ComponentRegistry registry = new ComponentRegistry();
        registry.registerComponent(PositionComponent.class, 0);
        registry.registerComponent(FixedIdComponent.class);
        registry.registerComponent(DummyComponent.class);

        assertEquals(0, registry.getNetworkId(PositionComponent.class));
        assertEquals(3, registry.getNetworkId(FixedIdComponent.class));
        assertEquals(1, registry.getNetworkId(DummyComponent.class), "Auto id skips ids already taken");
    }

    @Test
    void rejectsDuplicateNetworkIdAndName() {
        ComponentRegistry registry = new ComponentRegistry();
        registry.registerComponent(DummyComponent.class, 7);

        assertThrows(IllegalArgumentException.class, () -> registry.registerComponent(HealthComponent.class, 7));
        assertThrows(IllegalArgumentException.class, () -> registry.registerComponent(ClashingNameComponent.class));
        assertThrows(IllegalArgumentException.class, () -> registry.registerComponent(DummyComponent.class, 8),
                "Re-registering with a different id must fail");
        assertFalse(registry.isRegistered(HealthComponent.class));
    }

    @Test
    void rejectsAbstractTypes() {
        ComponentRegistry registry = new ComponentRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.registerComponent(ArmorBase.class));
    }

    @Test
    void frozenRegistryRefusesNewTypes() {
        ComponentRegistry registry = new ComponentRegistry();
        registry.registerComponent(HealthComponent.class);
        registry.freeze();
        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.registerComponent(PositionComponent.class));
        // already known types are still answered
        assertEquals(0, registry.registerComponent(HealthComponent.class));
    }

    @Test
    void unknownNetworkIdFails() {
        ComponentRegistry registry = new ComponentRegistry();
        UnknownNetworkIdException ex = assertThrows(UnknownNetworkIdException.class, () -> registry.getType(42));
        assertEquals(42, ex.getNetworkId());
    }

    @Test
    void capabilityIndexFollowsRegistrationOrderAndIncludesSuperclasses() {
        ComponentRegistry registry = new ComponentRegistry();
        registry.registerComponent(HealthComponent.class);
        registry.registerComponent(PositionComponent.class);
        registry.registerComponent(ArmorComponent.class);

        assertEquals(List.of(HealthComponent.class, ArmorComponent.class),
                List.copyOf(registry.getTypesWithCapability(IDamageable.class)));
        assertEquals(Set.of(ArmorComponent.class), registry.getTypesWithCapability(ArmorBase.class));
        assertEquals(Set.of(PositionComponent.class), registry.getTypesWithCapability(PositionComponent.class));
        assertTrue(registry.getTypesWithCapability(ICompType1.class).isEmpty());
        assertEquals(Set.of(ArmorBase.class, IDamageable.class), registry.getCapabilities(ArmorComponent.class));
    }
}
