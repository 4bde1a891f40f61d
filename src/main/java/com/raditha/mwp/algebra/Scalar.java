package com.raditha.mwp.algebra;

/**
 * The five growth scalars of the mwp semiring, totally ordered o &lt; m &lt; w &lt; p &lt; i.
 * <ul>
 * <li>o - no dependency</li>
 * <li>m - maximal (no growth)</li>
 * <li>w - weak polynomial</li>
 * <li>p - polynomial</li>
 * <li>i - infinity, no bound exists</li>
 * </ul>
 */
public enum Scalar {
    O("o"),
    M("m"),
    W("w"),
    P("p"),
    I("i");

    private final String symbol;

    Scalar(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Semiring sum: the maximum of the two operands.
     */
    public Scalar sum(Scalar other) {
        requireScalar(other);
        return compareTo(other) >= 0 ? this : other;
    }

    /**
     * Semiring product.
     * i absorbs everything, o absorbs every other operand, m is the identity and
     * the product of w and p is their maximum.
     */
    public Scalar product(Scalar other) {
        requireScalar(other);
        if (this == I || other == I) {
            return I;
        }
        if (this == O || other == O) {
            return O;
        }
        if (this == M) {
            return other;
        }
        if (other == M) {
            return this;
        }
        return sum(other);
    }

    public static Scalar sum(Scalar a, Scalar b) {
        requireScalar(a);
        return a.sum(b);
    }

    public static Scalar product(Scalar a, Scalar b) {
        requireScalar(a);
        return a.product(b);
    }

    /**
     * Parse a scalar from its one letter symbol.
     *
     * @throws IllegalArgumentException if the symbol is not one of o, m, w, p, i
     */
    public static Scalar fromSymbol(String symbol) {
        for (Scalar s : values()) {
            if (s.symbol.equals(symbol)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown scalar: " + symbol);
    }

    private static void requireScalar(Scalar s) {
        if (s == null) {
            throw new IllegalStateException("Semiring operand is not a scalar");
        }
    }

    @Override
    public String toString() {
        return symbol;
    }
}
