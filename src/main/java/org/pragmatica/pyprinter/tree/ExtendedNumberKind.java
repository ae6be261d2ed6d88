package org.pragmatica.pyprinter.tree;

/**
 * Numeric kinds the target has no lossless native representation for.
 */
public enum ExtendedNumberKind {
    INT64,
    UINT64,
    DECIMAL,
    BIG_INT
}
