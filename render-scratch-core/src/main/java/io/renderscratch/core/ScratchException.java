package io.renderscratch.core;

import java.util.Objects;

/**
 * Base class for scratch store errors.
 *
 * <p>All subclasses are raised synchronously to the caller of the failing operation.
 * The store is left as it was before the call.
 */
public abstract class ScratchException extends RuntimeException {

    protected ScratchException(String message) {
        super(message);
    }

    protected ScratchException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when two values cannot be combined with the requested operator
     * (numeric with text, text with a non-addition operator, integer overflow, division by zero).
     */
    public static class Arithmetic extends ScratchException {
        private final Operator operator;

        public Arithmetic(Operator operator, String message) {
            super(message);
            this.operator = Objects.requireNonNull(operator, "operator");
        }

        public Arithmetic(Operator operator, String message, Throwable cause) {
            super(message, cause);
            this.operator = Objects.requireNonNull(operator, "operator");
        }

        public Operator operator() {
            return operator;
        }
    }

    /**
     * Raised when a mapping-shaped operation targets a non-mapping key, or the other way round.
     */
    public static class TypeMismatch extends ScratchException {
        private final String key;
        private final ScratchValueType actual;

        public TypeMismatch(String key, ScratchValueType actual, String message) {
            super(message);
            this.key = key;
            this.actual = actual;
        }

        /**
         * The scratch key the failing operation targeted.
         */
        public String key() {
            return key;
        }

        /**
         * The shape currently stored under {@link #key()}.
         */
        public ScratchValueType actual() {
            return actual;
        }
    }
}
