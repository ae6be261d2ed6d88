package org.pragmatica.pyprinter.tree;

import java.util.Optional;

/**
 * A formal parameter with an optional annotation.
 */
public record Arg(String name, Optional<Expression> annotation) {

    public static Arg of(String name) {
        return new Arg(name, Optional.empty());
    }

    public static Arg annotated(String name, Expression annotation) {
        return new Arg(name, Optional.of(annotation));
    }
}
