package io.renderscratch.core;

/**
 * Binary operators understood by {@link Arithmetic}.
 */
public enum Operator {
    ADD('+'),
    SUBTRACT('-'),
    MULTIPLY('*'),
    DIVIDE('/');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * Resolves an operator from its template symbol.
     *
     * @throws IllegalArgumentException if the symbol is not one of {@code + - * /}
     */
    public static Operator fromSymbol(char symbol) {
        for (Operator op : values()) {
            if (op.symbol == symbol) return op;
        }
        throw new IllegalArgumentException("unknown operator: " + symbol);
    }
}
