package io.renderscratch.store;

import io.renderscratch.core.Arithmetic;
import io.renderscratch.core.ScratchException;
import io.renderscratch.core.ScratchValue;
import io.renderscratch.core.ScratchValueType;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Writable context used for stateful operations while rendering a page.
 *
 * <p>One instance belongs to one rendering context and is discarded afterwards. It is safe to share
 * between threads rendering in parallel: reads take the shared lock, writes take the exclusive lock,
 * and each public operation is atomic with respect to all others.
 *
 * <p>Stored values are immutable, so a value returned by {@link #get(String)} never changes under the caller.
 *
 * <pre>{@code
 * Scratch scratch = Scratch.create();
 * scratch.add("wordCount", 120);
 * scratch.add("wordCount", 80);               // 200
 * scratch.setInMap("toc", "b-intro", "Intro");
 * scratch.setInMap("toc", "a-cover", "Cover");
 * scratch.getSortedMapValues("toc");           // [Cover, Intro]
 * }</pre>
 */
public final class Scratch {
    private final Map<String, ScratchValue> values;
    private final Lock readLock;
    private final Lock writeLock;

    public Scratch() {
        this(ScratchConfig.defaults());
    }

    public Scratch(ScratchConfig config) {
        Objects.requireNonNull(config, "config");
        ReentrantReadWriteLock rw = new ReentrantReadWriteLock(config.fairLocking());
        this.readLock = rw.readLock();
        this.writeLock = rw.writeLock();
        this.values = new HashMap<>(config.initialCapacity());
    }

    public static Scratch create() {
        return new Scratch();
    }

    /**
     * Adds {@code addend} to the value stored under {@code key}.
     *
     * <p>If the key is absent the addend is stored as-is and fixes the shape for later adds.
     * If the stored value is a sequence, a sequence addend is appended element by element and
     * any other addend is appended as one element. Numbers and text are combined with {@code +}.
     *
     * @param key the scratch key
     * @param addend a {@link ScratchValue} or a host object accepted by {@link ScratchValue#of(Object)}
     * @throws ScratchException.Arithmetic if the stored value and the addend can't be added
     * @throws ScratchException.TypeMismatch if the key holds a mapping built by {@link #setInMap}
     */
    public void add(String key, Object addend) {
        Objects.requireNonNull(key, "key");
        ScratchValue next = ScratchValue.of(addend);

        writeLock.lock();
        try {
            ScratchValue existing = values.get(key);
            if (existing != null) {
                next = combine(key, existing, next);
            }
            values.put(key, next);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Stores {@code value} under {@code key}, replacing whatever was there.
     */
    public void set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        ScratchValue v = ScratchValue.of(value);

        writeLock.lock();
        try {
            values.put(key, v);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns the value previously stored by {@link #add}, {@link #set} or {@link #setInMap}.
     *
     * @return the value, or empty if the key was never set
     */
    public Optional<ScratchValue> get(String key) {
        Objects.requireNonNull(key, "key");
        readLock.lock();
        try {
            return Optional.ofNullable(values.get(key));
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Removes {@code key}.
     *
     * @return true if the key was present
     */
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        writeLock.lock();
        try {
            return values.remove(key) != null;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Stores {@code value} under {@code mapKey} in the mapping held by {@code key},
     * creating the mapping on first use. An existing entry for {@code mapKey} is replaced.
     *
     * @throws ScratchException.TypeMismatch if {@code key} holds a value that is not a mapping
     */
    public void setInMap(String key, String mapKey, Object value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(mapKey, "mapKey");
        ScratchValue v = ScratchValue.of(value);

        writeLock.lock();
        try {
            ScratchValue existing = values.get(key);
            ScratchValue.Mapping map = existing == null ? ScratchValue.Mapping.empty() : requireMapping(key, existing);
            values.put(key, map.with(mapKey, v));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns the values of the mapping filled by {@link #setInMap}, ordered by ascending map key.
     *
     * @return the sorted values, or empty if the key was never set
     * @throws ScratchException.TypeMismatch if {@code key} holds a value that is not a mapping
     */
    public Optional<ScratchValue.Sequence> getSortedMapValues(String key) {
        Objects.requireNonNull(key, "key");
        readLock.lock();
        try {
            ScratchValue existing = values.get(key);
            if (existing == null) return Optional.empty();
            return Optional.of(requireMapping(key, existing).sortedValues());
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Returns an immutable copy of every entry, ordered by key.
     */
    public ScratchValue.Mapping snapshot() {
        readLock.lock();
        try {
            return new ScratchValue.Mapping(values);
        } finally {
            readLock.unlock();
        }
    }

    public int size() {
        readLock.lock();
        try {
            return values.size();
        } finally {
            readLock.unlock();
        }
    }

    private static ScratchValue combine(String key, ScratchValue existing, ScratchValue addend) {
        switch (existing.type()) {
            case SEQUENCE:
                ScratchValue.Sequence seq = (ScratchValue.Sequence) existing;
                if (addend.type() == ScratchValueType.SEQUENCE) {
                    return seq.concat((ScratchValue.Sequence) addend);
                }
                return seq.append(addend);
            case NUMERIC:
            case TEXT:
                return Arithmetic.add(existing, addend);
            case MAPPING:
                throw new ScratchException.TypeMismatch(key, ScratchValueType.MAPPING,
                        "can't add to '" + key + "': it holds a map, use setInMap");
            default:
                throw new IllegalStateException("unhandled value type " + existing.type());
        }
    }

    private static ScratchValue.Mapping requireMapping(String key, ScratchValue value) {
        if (value.type() != ScratchValueType.MAPPING) {
            throw new ScratchException.TypeMismatch(key, value.type(),
                    "'" + key + "' holds a " + value.type().name().toLowerCase(Locale.ROOT) + ", not a map");
        }
        return (ScratchValue.Mapping) value;
    }
}
