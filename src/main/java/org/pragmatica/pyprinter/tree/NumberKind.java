package org.pragmatica.pyprinter.tree;

/**
 * Numeric kinds the target represents with its native number type.
 */
public enum NumberKind {
    INT8,
    UINT8,
    INT16,
    UINT16,
    INT32,
    UINT32,
    FLOAT32,
    FLOAT64;

    public boolean isUnsigned() {
        return this == UINT8 || this == UINT16 || this == UINT32;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT32 || this == FLOAT64;
    }
}
