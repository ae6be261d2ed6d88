package org.pragmatica.pyprinter.printer;

import org.pragmatica.pyprinter.sourcemap.SourceMapGenerator;
import org.pragmatica.pyprinter.tree.SourceLocation;

import java.io.IOException;
import java.util.Optional;

/**
 * {@link Printer} that buffers text until {@link #flush()} hands it to an {@link OutputSink}.
 *
 * <p>Owned by a single printing pass: not thread-safe, and never shared between units.
 * Closing the printer closes the sink.
 */
public final class BufferedPrinter implements Printer, AutoCloseable {

    private final OutputSink sink;
    private final SourceMapGenerator sourceMap;
    private final ImportPathRewriter importPaths;
    private final PrinterConfig config;
    private final StringBuilder buffer = new StringBuilder();

    private int indent;
    private int line = 1;
    private int column;

    private BufferedPrinter(OutputSink sink,
                            SourceMapGenerator sourceMap,
                            ImportPathRewriter importPaths,
                            PrinterConfig config) {
        this.sink = sink;
        this.sourceMap = sourceMap;
        this.importPaths = importPaths;
        this.config = config;
    }

    public static BufferedPrinter create(OutputSink sink, SourceMapGenerator sourceMap) {
        return new BufferedPrinter(sink, sourceMap, ImportPathRewriter.identity(), PrinterConfig.DEFAULT);
    }

    public static BufferedPrinter create(OutputSink sink,
                                         SourceMapGenerator sourceMap,
                                         ImportPathRewriter importPaths,
                                         PrinterConfig config) {
        return new BufferedPrinter(sink, sourceMap, importPaths, config);
    }

    @Override
    public int line() {
        return line;
    }

    @Override
    public int column() {
        return column;
    }

    public int indentation() {
        return indent;
    }

    @Override
    public void pushIndent() {
        indent++;
    }

    @Override
    public void popIndent() {
        if (indent > 0) {
            indent--;
        }
    }

    @Override
    public void print(String text, Optional<SourceLocation> loc) {
        if (column == 0) {
            var indentation = config.indentUnit().repeat(indent);
            buffer.append(indentation);
            column = indentation.length();
        }
        addMapping(loc, column);
        buffer.append(text);
        column += text.length();
    }

    @Override
    public void newline() {
        buffer.append(config.lineSeparator());
        line++;
        column = 0;
    }

    @Override
    public void addLocation(Optional<SourceLocation> loc) {
        // At the start of a line the next character lands after the indentation
        int target = column == 0
                     ? config.indentUnit().length() * indent
                     : column;
        addMapping(loc, target);
    }

    @Override
    public String makeImportPath(String path) {
        return importPaths.rewrite(path);
    }

    /**
     * Text printed since the last flush.
     */
    public String pending() {
        return buffer.toString();
    }

    /**
     * Write the buffered text to the sink and clear the buffer.
     */
    public void flush() throws IOException {
        if (buffer.length() == 0) {
            return;
        }
        sink.write(buffer.toString());
        buffer.setLength(0);
    }

    @Override
    public void close() throws IOException {
        sink.close();
    }

    private void addMapping(Optional<SourceLocation> loc, int generatedColumn) {
        loc.ifPresent(l -> sourceMap.addMapping(l.start().line(),
                                                l.start().column(),
                                                line,
                                                generatedColumn,
                                                l.identifierName()));
    }
}
