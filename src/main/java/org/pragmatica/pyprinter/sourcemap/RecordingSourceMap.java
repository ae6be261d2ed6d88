package org.pragmatica.pyprinter.sourcemap;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keeps every mapping in the order it was added.
 */
public final class RecordingSourceMap implements SourceMapGenerator {

    private final List<Mapping> mappings = new ArrayList<>();

    @Override
    public void addMapping(int originalLine, int originalColumn, int generatedLine, int generatedColumn, Optional<String> name) {
        mappings.add(new Mapping(originalLine, originalColumn, generatedLine, generatedColumn, name));
    }

    public List<Mapping> mappings() {
        return List.copyOf(mappings);
    }

    public int size() {
        return mappings.size();
    }
}
