package io.renderscratch.store;

import java.util.Objects;
import java.util.Properties;

/**
 * Scratch store options as defined at construction time.
 *
 * <p>Immutable configuration for lock fairness and initial table size.
 */
public final class ScratchConfig {
    public static final String P_FAIR_LOCKING = "render.scratch.fair-locking";
    public static final String P_INITIAL_CAPACITY = "render.scratch.initial-capacity";

    /** Largest accepted initial capacity; render-scope stores grow past it on demand. */
    public static final int MAX_INITIAL_CAPACITY = 1 << 16;

    private static final int DEFAULT_INITIAL_CAPACITY = 16;
    private static final ScratchConfig DEFAULTS = new ScratchConfig(false, DEFAULT_INITIAL_CAPACITY);

    private final boolean fairLocking;
    private final int initialCapacity;

    /**
     * Creates a new scratch configuration.
     *
     * @param fairLocking whether the store lock grants access in arrival order
     * @param initialCapacity initial size of the key table, between 0 and {@link #MAX_INITIAL_CAPACITY}
     */
    public ScratchConfig(boolean fairLocking, int initialCapacity) {
        if (initialCapacity < 0 || initialCapacity > MAX_INITIAL_CAPACITY) {
            throw new IllegalArgumentException(
                    "initialCapacity must be between 0 and " + MAX_INITIAL_CAPACITY + ": " + initialCapacity);
        }
        this.fairLocking = fairLocking;
        this.initialCapacity = initialCapacity;
    }

    public static ScratchConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads options from {@code render.scratch.*} properties. Missing keys keep their defaults.
     *
     * @param props the property source
     * @return the resulting configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static ScratchConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        boolean fair = DEFAULTS.fairLocking;
        String fairRaw = props.getProperty(P_FAIR_LOCKING);
        if (fairRaw != null) {
            String v = fairRaw.trim();
            if (!"true".equalsIgnoreCase(v) && !"false".equalsIgnoreCase(v)) {
                throw new IllegalArgumentException(P_FAIR_LOCKING + " must be true or false: " + fairRaw);
            }
            fair = Boolean.parseBoolean(v);
        }

        int capacity = DEFAULTS.initialCapacity;
        String capRaw = props.getProperty(P_INITIAL_CAPACITY);
        if (capRaw != null) {
            try {
                capacity = Integer.parseInt(capRaw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(P_INITIAL_CAPACITY + " must be an integer: " + capRaw, e);
            }
        }
        return new ScratchConfig(fair, capacity);
    }

    /**
     * Whether the read/write lock is fair.
     */
    public boolean fairLocking() {
        return fairLocking;
    }

    /**
     * Initial capacity of the backing key table.
     */
    public int initialCapacity() {
        return initialCapacity;
    }
}
