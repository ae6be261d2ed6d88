package org.pragmatica.pyprinter.sourcemap;

import java.util.Optional;

/**
 * Receives mappings from generated positions back to original positions.
 * The printer only writes to it; it never reads mappings back.
 */
@FunctionalInterface
public interface SourceMapGenerator {

    SourceMapGenerator NONE = (originalLine, originalColumn, generatedLine, generatedColumn, name) -> {};

    void addMapping(int originalLine, int originalColumn, int generatedLine, int generatedColumn, Optional<String> name);
}
