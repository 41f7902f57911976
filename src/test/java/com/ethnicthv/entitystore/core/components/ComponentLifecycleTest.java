package com.ethnicthv.entitystore.core.components;

import com.ethnicthv.entitystore.TestComponents.TrackedComponent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ComponentLifecycleTest {

    @Test
    void stagesMoveForwardOnly() {
        TrackedComponent c = new TrackedComponent();
        assertEquals(ComponentLifeStage.CREATED, c.getLifeStage());
        assertEquals(Component.NO_OWNER, c.getOwner());
        assertFalse(c.isAlive());

        ComponentLifecycle.attach(c, 5);
        assertEquals(5, c.getOwner());
        assertTrue(c.isAlive());
        assertFalse(c.isDeleted());

        assertTrue(ComponentLifecycle.markPending(c));
        assertFalse(ComponentLifecycle.markPending(c), "Second mark is a no-op");
        assertFalse(c.isAlive());
        assertTrue(c.isDeleted());

        assertTrue(ComponentLifecycle.shutdown(c));
        assertFalse(ComponentLifecycle.shutdown(c));
        assertEquals(ComponentLifeStage.CULLED, c.getLifeStage());
        assertEquals(1, c.shutdowns, "Shutdown hook runs once");
    }

    @Test
    void attachRejectsReuse() {
        TrackedComponent c = new TrackedComponent();
        ComponentLifecycle.attach(c, 1);
        assertThrows(IllegalStateException.class, () -> ComponentLifecycle.attach(c, 1));

        ComponentLifecycle.shutdown(c);
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ComponentLifecycle.checkAttachable(c, 1));
        assertTrue(ex.getMessage().contains("culled"));
    }

    @Test
    void markPendingIgnoresUnattached() {
        TrackedComponent c = new TrackedComponent();
        assertFalse(ComponentLifecycle.markPending(c));
        assertEquals(ComponentLifeStage.CREATED, c.getLifeStage());
    }
}
