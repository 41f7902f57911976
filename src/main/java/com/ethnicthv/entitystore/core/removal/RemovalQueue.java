package com.ethnicthv.entitystore.core.removal;

import com.ethnicthv.entitystore.core.InvalidEntityException;
import com.ethnicthv.entitystore.core.components.Component;
import com.ethnicthv.entitystore.core.components.ComponentLifeStage;
import com.ethnicthv.entitystore.core.components.ComponentLifecycle;
import com.ethnicthv.entitystore.core.entity.EntityDestructionListener;
import com.ethnicthv.entitystore.core.entity.EntityDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * RemovalQueue - two-phase component removal.
 * <p>
 * Phase 1 ({@link #markRemoved}) flips the component to
 * {@link ComponentLifeStage#REMOVED_PENDING_CULL}: it disappears from every lookup and query at
 * once, but stays in the directory and index, so iterations in progress are not disturbed.
 * Phase 2 ({@link #cull()}) performs the final detachment for everything marked so far.
 */
public final class RemovalQueue implements EntityDestructionListener {
    private static final Logger log = LoggerFactory.getLogger(RemovalQueue.class);

    private final EntityDirectory directory;
    private final ArrayDeque<PendingRemoval> queue = new ArrayDeque<>();

    /**
     * One queued removal. The instance is kept so that a newer component attached to the same
     * slot is never culled by mistake.
     */
    record PendingRemoval(int entityId, Class<? extends Component> type, Component component) {
    }

    public RemovalQueue(EntityDirectory directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    /**
     * Mark the live component of {@code type} on {@code entityId} for removal.
     *
     * @return false if there was no live component (absent or already pending)
     * @throws InvalidEntityException if the entity does not exist
     */
    public boolean markRemoved(int entityId, Class<? extends Component> type) {
        Objects.requireNonNull(type, "type");
        if (!directory.isKnown(entityId)) {
            throw new InvalidEntityException(entityId);
        }
        Component component = directory.peek(entityId, type);
        if (component == null) {
            return false;
        }
        return enqueue(component);
    }

    /**
     * Mark by network id.
     *
     * @throws com.ethnicthv.entitystore.core.UnknownNetworkIdException if {@code networkId} is not registered
     */
    public boolean markRemoved(int entityId, int networkId) {
        return markRemoved(entityId, directory.getIndex().resolveType(networkId));
    }

    /**
     * Mark a specific instance for removal. No-op unless the instance is alive.
     */
    public boolean markRemoved(Component component) {
        Objects.requireNonNull(component, "component");
        return enqueue(component);
    }

    private boolean enqueue(Component component) {
        if (!ComponentLifecycle.markPending(component)) {
            return false;
        }
        queue.add(new PendingRemoval(component.getOwner(), component.getClass(), component));
        log.debug("Entity {}: {} marked for removal", component.getOwner(), component.getClass().getSimpleName());
        return true;
    }

    /**
     * Finalize every queued removal. Removals requested by shutdown handlers while culling are
     * drained by the same call. Entries whose component was already culled (overwrite, entity
     * destruction) are skipped.
     *
     * @return number of components culled by this call
     */
    public int cull() {
        int culled = 0;
        PendingRemoval entry;
        while ((entry = queue.poll()) != null) {
            if (finish(entry)) {
                culled++;
            }
        }
        if (culled > 0) {
            log.debug("Culled {} components", culled);
        }
        return culled;
    }

    /**
     * Finalize only the queued removals of one entity.
     *
     * @return number of components culled
     */
    public int cullEntity(int entityId) {
        List<PendingRemoval> matching = new ArrayList<>();
        Iterator<PendingRemoval> it = queue.iterator();
        while (it.hasNext()) {
            PendingRemoval entry = it.next();
            if (entry.entityId() == entityId) {
                matching.add(entry);
                it.remove();
            }
        }
        int culled = 0;
        for (PendingRemoval entry : matching) {
            if (finish(entry)) {
                culled++;
            }
        }
        return culled;
    }

    private boolean finish(PendingRemoval entry) {
        if (entry.component().getLifeStage() != ComponentLifeStage.REMOVED_PENDING_CULL) {
            return false;
        }
        return directory.cullComponent(entry.component());
    }

    /**
     * Entity shutdown: queued removals of the entity are culled right away.
     */
    @Override
    public void onEntityShutdown(int entityId) {
        cullEntity(entityId);
    }

    public int pendingCount() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * True if the (entity, type) slot holds a component waiting for the next cull.
     */
    public boolean isPending(int entityId, Class<? extends Component> type) {
        Component component = directory.peek(entityId, type);
        return component != null && component.getLifeStage() == ComponentLifeStage.REMOVED_PENDING_CULL;
    }
}
