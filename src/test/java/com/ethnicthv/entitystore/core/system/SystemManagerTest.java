package com.ethnicthv.entitystore.core.system;

import com.ethnicthv.entitystore.EntityStore;
import com.ethnicthv.entitystore.TestComponents.HealthComponent;
import com.ethnicthv.entitystore.core.api.IEntityStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SystemManagerTest {

    static class RecordingSystem extends BaseSystem {
        final String name;
        final List<String> log;

        RecordingSystem(String name, List<String> log) {
            this.name = name;
            this.log = log;
        }

        @Override
        public void onUpdate(float deltaTime) {
            log.add(name);
        }

        @Override
        public void onDispose() {
            log.add("dispose:" + name);
        }
    }

    /**
     * Removes every dead health component; the removals stay pending for the rest of the tick.
     */
    static class ReaperSystem extends BaseSystem {
        @Override
        public void onUpdate(float deltaTime) {
            for (HealthComponent health : store.entityQuery(HealthComponent.class)) {
                if (health.hp <= 0) {
                    store.removeComponent(health);
                }
            }
        }
    }

    @Test
    void groupsRunInPriorityOrderAndDisposeInReverse() {
        List<String> log = new ArrayList<>();
        EntityStore store = EntityStore.builder()
                .addSystem(new RecordingSystem("cleanup", log), SystemGroup.CLEANUP)
                .addSystem(new RecordingSystem("sim", log))
                .addSystem(new RecordingSystem("input", log), SystemGroup.INPUT)
                .build();

        store.update(0.016f);
        assertEquals(List.of("input", "sim", "cleanup"), log);

        log.clear();
        store.close();
        assertEquals(List.of("dispose:cleanup", "dispose:sim", "dispose:input"), log);
    }

    @Test
    void disabledSystemsAreSkipped() {
        List<String> log = new ArrayList<>();
        RecordingSystem sim = new RecordingSystem("sim", log);
        EntityStore store = EntityStore.builder().addSystem(sim).build();

        sim.setEnabled(false);
        store.update(1f);
        assertTrue(log.isEmpty());

        sim.setEnabled(true);
        store.getSystemManager().updateGroup(SystemGroup.SIMULATION, 1f);
        assertEquals(List.of("sim"), log);
    }

    @Test
    void removalsDuringTickAreCulledAtEndOfUpdate() {
        ReaperSystem reaper = new ReaperSystem();
        List<Boolean> visibleDuringCleanup = new ArrayList<>();
        BaseSystem observer = new BaseSystem() {
            @Override
            public void onUpdate(float deltaTime) {
                visibleDuringCleanup.add(store.entitiesWith(HealthComponent.class).iterator().hasNext());
            }
        };
        EntityStore store = EntityStore.builder()
                .registerComponent(HealthComponent.class)
                .addSystem(reaper, SystemGroup.SIMULATION)
                .addSystem(observer, SystemGroup.CLEANUP)
                .build();
        int e = store.createEntity();
        HealthComponent h = store.addComponent(e, new HealthComponent(0));

        store.update(1f);

        assertEquals(List.of(false), visibleDuringCleanup, "Removed component is invisible to later systems");
        assertTrue(store.getRemovalQueue().isEmpty(), "Cull point ran after all groups");
        assertNull(store.getDirectory().peek(e, HealthComponent.class));
        assertTrue(h.isDeleted());
    }

    @Test
    void cullOnUpdateCanBeDisabled() {
        EntityStore store = EntityStore.builder()
                .registerComponent(HealthComponent.class)
                .addSystem(new ReaperSystem())
                .cullOnUpdate(false)
                .build();
        int e = store.createEntity();
        store.addComponent(e, new HealthComponent(0));

        store.update(1f);

        assertEquals(1, store.getRemovalQueue().pendingCount());
        assertEquals(1, store.cullRemovedComponents());
    }

    @Test
    void systemsReceiveStoreOnRegistration() {
        List<IEntityStore> seen = new ArrayList<>();
        ISystem system = new BaseSystem() {
            @Override
            public void onAwake(IEntityStore store) {
                super.onAwake(store);
                seen.add(store);
            }

            @Override
            public void onUpdate(float deltaTime) {
            }
        };
        EntityStore store = EntityStore.builder().addSystem(system, SystemGroup.PHYSICS).build();

        assertEquals(List.of(store), seen);
        assertEquals(List.of(system), store.getSystemManager().getSystems(SystemGroup.PHYSICS));
        assertEquals(1, store.getSystemManager().getRegisteredSystems().size());
    }
}
