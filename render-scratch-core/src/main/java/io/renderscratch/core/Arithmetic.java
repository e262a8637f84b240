package io.renderscratch.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Binary arithmetic over scratch values.
 *
 * <p>Supported pairs:
 * <ul>
 *   <li>numeric and numeric: all operators. Two integral operands stay integral (overflow and
 *       division by zero fail), otherwise both are promoted to {@code double}</li>
 *   <li>text and text: {@link Operator#ADD} only, as concatenation</li>
 * </ul>
 * Every other pair fails with {@link ScratchException.Arithmetic}.
 */
public final class Arithmetic {
    private Arithmetic() {}

    public static ScratchValue apply(ScratchValue left, ScratchValue right, Operator op) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(op, "op");

        switch (left.type()) {
            case NUMERIC:
                if (right.type() == ScratchValueType.NUMERIC) {
                    return numeric((ScratchValue.Numeric) left, (ScratchValue.Numeric) right, op);
                }
                break;
            case TEXT:
                if (right.type() == ScratchValueType.TEXT) {
                    return text((ScratchValue.Text) left, (ScratchValue.Text) right, op);
                }
                break;
            case SEQUENCE:
            case MAPPING:
                break;
        }
        throw incompatible(left, right, op);
    }

    public static ScratchValue add(ScratchValue left, ScratchValue right) {
        return apply(left, right, Operator.ADD);
    }

    private static ScratchValue numeric(ScratchValue.Numeric a, ScratchValue.Numeric b, Operator op) {
        if (a.isIntegral() && b.isIntegral()) {
            return new ScratchValue.Numeric(integral(a.longValue(), b.longValue(), op));
        }
        return new ScratchValue.Numeric(decimal(a.doubleValue(), b.doubleValue(), op));
    }

    private static long integral(long a, long b, Operator op) {
        try {
            switch (op) {
                case ADD:
                    return Math.addExact(a, b);
                case SUBTRACT:
                    return Math.subtractExact(a, b);
                case MULTIPLY:
                    return Math.multiplyExact(a, b);
                case DIVIDE:
                    if (b == 0) throw new ScratchException.Arithmetic(op, "can't divide the value by 0");
                    if (a == Long.MIN_VALUE && b == -1) throw new ArithmeticException("long overflow");
                    return a / b;
                default:
                    throw new IllegalStateException("unhandled operator " + op);
            }
        } catch (ArithmeticException e) {
            throw new ScratchException.Arithmetic(op, "integer overflow: " + a + " " + op.symbol() + " " + b, e);
        }
    }

    private static double decimal(double a, double b, Operator op) {
        switch (op) {
            case ADD:
                return a + b;
            case SUBTRACT:
                return a - b;
            case MULTIPLY:
                return a * b;
            case DIVIDE:
                return a / b;
            default:
                throw new IllegalStateException("unhandled operator " + op);
        }
    }

    private static ScratchValue text(ScratchValue.Text a, ScratchValue.Text b, Operator op) {
        if (op != Operator.ADD) {
            throw new ScratchException.Arithmetic(op, "operator '" + op.symbol() + "' is not supported for text values");
        }
        return new ScratchValue.Text(a.value() + b.value());
    }

    private static ScratchException.Arithmetic incompatible(ScratchValue left, ScratchValue right, Operator op) {
        return new ScratchException.Arithmetic(op,
                "can't apply '" + op.symbol() + "' to " + describe(left) + " and " + describe(right));
    }

    private static String describe(ScratchValue v) {
        return v.type().name().toLowerCase(Locale.ROOT);
    }
}
