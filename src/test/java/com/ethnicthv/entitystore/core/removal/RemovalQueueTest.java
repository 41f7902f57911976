package com.ethnicthv.entitystore.core.removal;

import com.ethnicthv.entitystore.TestComponents.DummyComponent;
import com.ethnicthv.entitystore.TestComponents.HealthComponent;
import com.ethnicthv.entitystore.TestComponents.TrackedComponent;
import com.ethnicthv.entitystore.core.InvalidEntityException;
import com.ethnicthv.entitystore.core.UnknownNetworkIdException;
import com.ethnicthv.entitystore.core.api.IEventSink;
import com.ethnicthv.entitystore.core.components.ComponentLifeStage;
import com.ethnicthv.entitystore.core.components.ComponentRegistry;
import com.ethnicthv.entitystore.core.entity.EntityDirectory;
import com.ethnicthv.entitystore.core.index.ComponentIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RemovalQueueTest {

    private EntityDirectory directory;
    private RemovalQueue queue;

    @BeforeEach
    void setUp() {
        ComponentRegistry registry = new ComponentRegistry();
        registry.registerComponent(DummyComponent.class, 7);
        registry.registerComponent(HealthComponent.class);
        registry.registerComponent(TrackedComponent.class);
        registry.freeze();
        directory = new EntityDirectory(new ComponentIndex(registry), IEventSink.NONE);
        queue = new RemovalQueue(directory);
        directory.addDestructionListener(queue);
    }

    @Test
    void markHidesImmediatelyAndCullDetaches() {
        int e = directory.createEntity();
        TrackedComponent t = directory.attach(e, new TrackedComponent(), false);

        assertTrue(queue.markRemoved(e, TrackedComponent.class));
        assertTrue(queue.isPending(e, TrackedComponent.class));
        assertNull(directory.tryGet(e, TrackedComponent.class));
        assertSame(t, directory.peek(e, TrackedComponent.class), "Still held until cull");
        assertEquals(0, t.shutdowns);

        assertEquals(1, queue.cull());
        assertNull(directory.peek(e, TrackedComponent.class));
        assertEquals(1, t.shutdowns);
        assertTrue(queue.isEmpty());
    }

    @Test
    void markingTwiceAndCullingTwiceAreNoOps() {
        int e = directory.createEntity();
        TrackedComponent t = directory.attach(e, new TrackedComponent(), false);

        assertTrue(queue.markRemoved(e, TrackedComponent.class));
        assertFalse(queue.markRemoved(e, TrackedComponent.class));
        assertFalse(queue.markRemoved(t));
        assertEquals(1, queue.pendingCount());

        assertEquals(1, queue.cull());
        assertEquals(0, queue.cull());
        assertEquals(1, t.shutdowns);
    }

    @Test
    void markAbsentReturnsFalseAndUnknownEntityFails() {
        int e = directory.createEntity();
        assertFalse(queue.markRemoved(e, HealthComponent.class));
        assertThrows(InvalidEntityException.class, () -> queue.markRemoved(123, HealthComponent.class));
        assertThrows(UnknownNetworkIdException.class, () -> queue.markRemoved(e, 99));
    }

    @Test
    void markByNetworkId() {
        int e = directory.createEntity();
        DummyComponent d = directory.attach(e, new DummyComponent(), false);
        assertTrue(queue.markRemoved(e, 7));
        assertEquals(ComponentLifeStage.REMOVED_PENDING_CULL, d.getLifeStage());
    }

    @Test
    void removalsRequestedDuringCullAreDrainedBySameCull() {
        int e = directory.createEntity();
        TrackedComponent t = directory.attach(e, new TrackedComponent(), false);
        HealthComponent h = directory.attach(e, new HealthComponent(), false);
        t.onShutdownAction = () -> queue.markRemoved(e, HealthComponent.class);

        queue.markRemoved(e, TrackedComponent.class);
        assertEquals(2, queue.cull());

        assertEquals(ComponentLifeStage.CULLED, h.getLifeStage());
        assertTrue(queue.isEmpty());
    }

    @Test
    void removeThenAttachWithoutCullKeepsNewComponent() {
        int e = directory.createEntity();
        TrackedComponent first = directory.attach(e, new TrackedComponent(), false);
        queue.markRemoved(e, TrackedComponent.class);

        TrackedComponent second = directory.attach(e, new TrackedComponent(), false);
        assertEquals(1, first.shutdowns);

        assertEquals(0, queue.cull(), "Stale entry must not cull the replacement");
        assertSame(second, directory.get(e, TrackedComponent.class));
        assertEquals(0, second.shutdowns);
    }

    @Test
    void destroyingEntityFlushesItsPendingRemovals() {
        int e = directory.createEntity();
        int other = directory.createEntity();
        TrackedComponent t = directory.attach(e, new TrackedComponent(), false);
        TrackedComponent keep = directory.attach(other, new TrackedComponent(), false);
        queue.markRemoved(e, TrackedComponent.class);
        queue.markRemoved(other, TrackedComponent.class);

        directory.destroyEntity(e);

        assertEquals(1, t.shutdowns);
        assertEquals(1, queue.pendingCount());
        assertEquals(0, keep.shutdowns);
        assertEquals(1, queue.cull());
    }
}
