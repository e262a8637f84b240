package io.renderscratch.core;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A dynamically-typed value held by a scratch store.
 *
 * <p>Every value is one of four shapes, reported by {@link #type()}:
 * <ul>
 *   <li>{@link Numeric}: an integral ({@code long}) or decimal ({@code double}) number</li>
 *   <li>{@link Text}: a string</li>
 *   <li>{@link Sequence}: an ordered list of values, element shapes may differ</li>
 *   <li>{@link Mapping}: string keys to values, iterated in ascending key order</li>
 * </ul>
 *
 * <p>Values are immutable. Operations that grow a value return a new instance.
 */
public sealed interface ScratchValue permits ScratchValue.Numeric, ScratchValue.Text, ScratchValue.Sequence, ScratchValue.Mapping {

    /**
     * Returns the value shape.
     */
    ScratchValueType type();

    /**
     * Converts this value back to plain Java objects:
     * {@code Long}, {@code Double}, {@code String}, {@code List} or a sorted {@code Map}.
     */
    Object toJava();

    /**
     * Converts a host object to a scratch value.
     *
     * <p>Accepts scratch values (returned as-is), numbers, character sequences, characters,
     * iterables, arrays and maps with string keys. Containers are converted recursively.
     *
     * @param value the host object
     * @return the scratch value
     * @throws IllegalArgumentException if the object (or a nested element) has no scratch counterpart
     */
    static ScratchValue of(Object value) {
        return convert(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    static Numeric of(long value) {
        return new Numeric(value);
    }

    static Numeric of(double value) {
        return new Numeric(value);
    }

    static Text of(String value) {
        return new Text(value);
    }

    static Sequence sequenceOf(Object... elements) {
        return (Sequence) of(elements);
    }

    private static ScratchValue convert(Object value, Set<Object> enclosing) {
        if (value == null) throw new IllegalArgumentException("null has no scratch value");
        if (value instanceof ScratchValue sv) return sv;
        if (value instanceof Number n) return new Numeric(n);
        if (value instanceof CharSequence cs) return new Text(cs.toString());
        if (value instanceof Character c) return new Text(c.toString());
        boolean container = value instanceof Map<?, ?> || value instanceof Iterable<?> || value.getClass().isArray();
        if (!container) {
            throw new IllegalArgumentException("unsupported scratch value type: " + describe(value));
        }
        if (!enclosing.add(value)) {
            throw new IllegalArgumentException("cycle detected: " + describe(value) + " contains itself");
        }
        try {
            if (value instanceof Map<?, ?> map) {
                Map<String, ScratchValue> entries = new LinkedHashMap<>();
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    if (!(e.getKey() instanceof String key)) {
                        throw new IllegalArgumentException("map keys must be strings, got " + describe(e.getKey()));
                    }
                    entries.put(key, convert(e.getValue(), enclosing));
                }
                return new Mapping(entries);
            }
            List<ScratchValue> elements = new ArrayList<>();
            if (value instanceof Iterable<?> it) {
                for (Object o : it) elements.add(convert(o, enclosing));
            } else {
                int len = Array.getLength(value);
                for (int i = 0; i < len; i++) elements.add(convert(Array.get(value, i), enclosing));
            }
            return new Sequence(elements);
        } finally {
            enclosing.remove(value);
        }
    }

    private static String describe(Object o) {
        return o == null ? "null" : o.getClass().getName();
    }

    /**
     * A number, normalized to {@code Long} for integral inputs and {@code Double} otherwise.
     *
     * @param value the normalized number
     */
    record Numeric(Number value) implements ScratchValue {
        public Numeric {
            value = normalize(Objects.requireNonNull(value, "value"));
        }

        public boolean isIntegral() {
            return value instanceof Long;
        }

        public long longValue() {
            return value.longValue();
        }

        public double doubleValue() {
            return value.doubleValue();
        }

        @Override
        public ScratchValueType type() {
            return ScratchValueType.NUMERIC;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return value.toString();
        }

        private static Number normalize(Number n) {
            if (n instanceof Long || n instanceof Double) return n;
            if (n instanceof Integer || n instanceof Short || n instanceof Byte
                    || n instanceof AtomicInteger || n instanceof AtomicLong) {
                return n.longValue();
            }
            if (n instanceof BigInteger big) {
                if (big.bitLength() < Long.SIZE) return big.longValue();
                throw new IllegalArgumentException("integer out of long range: " + big);
            }
            if (n instanceof Float || n instanceof BigDecimal) return n.doubleValue();
            throw new IllegalArgumentException("unsupported number type: " + n.getClass().getName());
        }
    }

    /**
     * A string value.
     *
     * @param value the text, never null
     */
    record Text(String value) implements ScratchValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ScratchValueType type() {
            return ScratchValueType.TEXT;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * An ordered list of values.
     *
     * @param elements immutable element list
     */
    record Sequence(List<ScratchValue> elements) implements ScratchValue {
        public Sequence {
            elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        }

        public int size() {
            return elements.size();
        }

        /**
         * Returns a new sequence with {@code element} appended as a single element.
         */
        public Sequence append(ScratchValue element) {
            Objects.requireNonNull(element, "element");
            List<ScratchValue> next = new ArrayList<>(elements.size() + 1);
            next.addAll(elements);
            next.add(element);
            return new Sequence(next);
        }

        /**
         * Returns a new sequence with the elements of {@code other} appended one by one.
         */
        public Sequence concat(Sequence other) {
            Objects.requireNonNull(other, "other");
            List<ScratchValue> next = new ArrayList<>(elements.size() + other.elements.size());
            next.addAll(elements);
            next.addAll(other.elements);
            return new Sequence(next);
        }

        @Override
        public ScratchValueType type() {
            return ScratchValueType.SEQUENCE;
        }

        @Override
        public Object toJava() {
            List<Object> out = new ArrayList<>(elements.size());
            for (ScratchValue v : elements) out.add(v.toJava());
            return Collections.unmodifiableList(out);
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }

    /**
     * A nested mapping from string keys to values, kept in ascending lexicographic key order.
     *
     * @param entries immutable sorted entries
     */
    record Mapping(SortedMap<String, ScratchValue> entries) implements ScratchValue {
        public Mapping {
            Objects.requireNonNull(entries, "entries");
            TreeMap<String, ScratchValue> copy = new TreeMap<>();
            for (Map.Entry<String, ScratchValue> e : entries.entrySet()) {
                copy.put(Objects.requireNonNull(e.getKey(), "key"), Objects.requireNonNull(e.getValue(), "value"));
            }
            entries = Collections.unmodifiableSortedMap(copy);
        }

        public Mapping(Map<String, ScratchValue> entries) {
            this(new TreeMap<String, ScratchValue>(Objects.requireNonNull(entries, "entries")));
        }

        public static Mapping empty() {
            return new Mapping(new TreeMap<String, ScratchValue>());
        }

        public int size() {
            return entries.size();
        }

        /**
         * Returns a new mapping with {@code key} set to {@code value}, replacing any prior entry.
         */
        public Mapping with(String key, ScratchValue value) {
            TreeMap<String, ScratchValue> next = new TreeMap<>(entries);
            next.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return new Mapping(next);
        }

        /**
         * Returns the values ordered by ascending key, keys discarded.
         */
        public Sequence sortedValues() {
            return new Sequence(new ArrayList<>(entries.values()));
        }

        @Override
        public ScratchValueType type() {
            return ScratchValueType.MAPPING;
        }

        @Override
        public Object toJava() {
            TreeMap<String, Object> out = new TreeMap<>();
            for (Map.Entry<String, ScratchValue> e : entries.entrySet()) {
                out.put(e.getKey(), e.getValue().toJava());
            }
            return Collections.unmodifiableSortedMap(out);
        }

        @Override
        public String toString() {
            return entries.toString();
        }
    }
}
