package org.pragmatica.pyprinter.tree;

import java.util.Optional;

/**
 * Imported name with an optional local alias.
 */
public record Alias(String name, Optional<String> asName) {

    public static Alias of(String name) {
        return new Alias(name, Optional.empty());
    }

    public static Alias of(String name, String asName) {
        return new Alias(name, Optional.of(asName));
    }

    /**
     * Alias text to print, if it actually renames the import.
     */
    public Optional<String> effectiveAlias() {
        return asName.filter(alias -> !alias.equals(name));
    }
}
