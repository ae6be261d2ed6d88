package org.pragmatica.pyprinter.sourcemap;

import java.util.Optional;

/**
 * One source-map entry. Generated lines are 1-based, generated columns 0-based.
 */
public record Mapping(int originalLine, int originalColumn, int generatedLine, int generatedColumn, Optional<String> name) {

    @Override
    public String toString() {
        return originalLine + ":" + originalColumn + " -> " + generatedLine + ":" + generatedColumn
               + name.map(n -> " (" + n + ")").orElse("");
    }
}
