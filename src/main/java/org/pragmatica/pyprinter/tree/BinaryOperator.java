package org.pragmatica.pyprinter.tree;

/**
 * Arithmetic and bitwise operators.
 */
public enum BinaryOperator {
    ADD(" + "),
    SUB(" - "),
    MULT(" * "),
    DIV(" / "),
    FLOOR_DIV(" // "),
    MOD(" % "),
    POW(" ** "),
    LSHIFT(" << "),
    RSHIFT(" >> "),
    BIT_OR(" | "),
    BIT_XOR(" ^ "),
    BIT_AND(" & "),
    MAT_MULT(" @ ");

    private final String text;

    BinaryOperator(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
