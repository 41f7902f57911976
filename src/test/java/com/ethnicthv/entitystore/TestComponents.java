package com.ethnicthv.entitystore;

import com.ethnicthv.entitystore.core.components.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Component types shared by the store tests.
 */
public final class TestComponents {

    private TestComponents() {
    }

    public interface ICompType1 {
    }

    public interface ICompType2 {
    }

    public interface IDamageable {
        int health();
    }

    /**
     * Networked component implementing two capabilities.
     */
    @Component.Networked
    @Component.Name("Dummy")
    public static class DummyComponent extends Component implements ICompType1, ICompType2 {
    }

    /**
     * Counts its lifecycle hooks.
     */
    public static class TrackedComponent extends Component {
        public int added;
        public int shutdowns;
        public Runnable onShutdownAction;

        @Override
        protected void onAdd() {
            added++;
        }

        @Override
        protected void onShutdown() {
            shutdowns++;
            if (onShutdownAction != null) {
                onShutdownAction.run();
            }
        }
    }

    public static class HealthComponent extends Component implements IDamageable {
        public int hp;

        public HealthComponent() {
            this(100);
        }

        public HealthComponent(int hp) {
            this.hp = hp;
        }

        @Override
        public int health() {
            return hp;
        }
    }

    public static class PositionComponent extends Component {
        public float x;
        public float y;
    }

    /**
     * Shares {@link IDamageable} with {@link HealthComponent} through an abstract base.
     */
    public abstract static class ArmorBase extends Component implements IDamageable {
    }

    public static class ArmorComponent extends ArmorBase {
        @Override
        public int health() {
            return 50;
        }
    }

    public static class UnregisteredComponent extends Component {
    }

    public static <T> List<T> toList(Iterable<T> iterable) {
        List<T> list = new ArrayList<>();
        for (T t : iterable) {
            list.add(t);
        }
        return list;
    }
}
