package org.pragmatica.pyprinter.tree;

/**
 * Keyword argument at a call site: {@code name=value}.
 */
public record Keyword(String name, Expression value) {

    public static Keyword of(String name, Expression value) {
        return new Keyword(name, value);
    }
}
