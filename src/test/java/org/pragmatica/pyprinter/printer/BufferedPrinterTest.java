package org.pragmatica.pyprinter.printer;

import org.junit.jupiter.api.Test;
import org.pragmatica.pyprinter.error.FailurePolicy;
import org.pragmatica.pyprinter.sourcemap.Mapping;
import org.pragmatica.pyprinter.sourcemap.RecordingSourceMap;
import org.pragmatica.pyprinter.tree.SourceLocation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BufferedPrinterTest {

    private final StringBuilder out = new StringBuilder();
    private final RecordingSourceMap sourceMap = new RecordingSourceMap();
    private final BufferedPrinter printer = BufferedPrinter.create(OutputSink.toStringBuilder(out), sourceMap);

    // === Position tracking ===

    @Test
    void freshPrinter_startsAtLineOneColumnZero() {
        assertEquals(1, printer.line());
        assertEquals(0, printer.column());
        assertEquals(0, printer.indentation());
    }

    @Test
    void print_advancesColumnByTextLength() {
        printer.print("abc");
        printer.print("de");

        assertEquals(5, printer.column());
        assertEquals("abcde", printer.pending());
    }

    @Test
    void newline_incrementsLineAndResetsColumn() {
        printer.print("x");
        printer.newline();

        assertEquals(2, printer.line());
        assertEquals(0, printer.column());
    }

    // === Indentation ===

    @Test
    void print_atLineStart_emitsIndentationFirst() {
        printer.pushIndent();
        printer.pushIndent();
        printer.print("pass");

        assertEquals("        pass", printer.pending());
        assertEquals(12, printer.column());
    }

    @Test
    void print_midLine_doesNotIndent() {
        printer.pushIndent();
        printer.print("a");
        printer.print("b");

        assertEquals("    ab", printer.pending());
    }

    @Test
    void popIndent_neverGoesBelowZero() {
        printer.popIndent();
        printer.popIndent();
        printer.print("x");

        assertEquals(0, printer.indentation());
        assertEquals("x", printer.pending());
    }

    @Test
    void emptyPrint_atLineStart_stillIndents() {
        printer.pushIndent();
        printer.print("");

        assertEquals("    ", printer.pending());
        assertEquals(4, printer.column());
    }

    @Test
    void customConfig_usesIndentUnitAndLineSeparator() {
        var config = new PrinterConfig("\t", "\r\n", FailurePolicy.REPORT);
        var custom = BufferedPrinter.create(OutputSink.toStringBuilder(out), sourceMap, ImportPathRewriter.identity(), config);

        custom.print("if x:");
        custom.newline();
        custom.pushIndent();
        custom.print("pass");

        assertEquals("if x:\r\n\tpass", custom.pending());
    }

    // === Source mappings ===

    @Test
    void print_withLocation_mapsFirstCharacterAfterIndentation() {
        printer.print("def f():");
        printer.newline();
        printer.pushIndent();
        printer.print("return", Optional.of(SourceLocation.at(3, 4)));

        assertThat(sourceMap.mappings())
            .containsExactly(new Mapping(3, 4, 2, 4, Optional.empty()));
    }

    @Test
    void addLocation_atLineStart_pointsPastIndentation() {
        printer.pushIndent();
        printer.pushIndent();
        printer.addLocation(Optional.of(SourceLocation.named(7, 2, "value")));

        assertThat(sourceMap.mappings())
            .containsExactly(new Mapping(7, 2, 1, 8, Optional.of("value")));
        assertEquals("", printer.pending());
    }

    @Test
    void addLocation_midLine_usesCurrentColumn() {
        printer.print("x = ");
        printer.addLocation(Optional.of(SourceLocation.at(1, 10)));

        assertEquals(4, sourceMap.mappings().get(0).generatedColumn());
    }

    @Test
    void print_withoutLocation_recordsNothing() {
        printer.print("x");
        printer.addLocation(Optional.empty());

        assertEquals(0, sourceMap.size());
    }

    // === Flushing ===

    @Test
    void flush_writesPendingTextAndClearsBuffer() throws IOException {
        printer.print("a = 1");
        printer.newline();
        printer.flush();

        assertEquals("a = 1\n", out.toString());
        assertEquals("", printer.pending());
    }

    @Test
    void flush_keepsPositionAcrossChunks() throws IOException {
        printer.print("abc");
        printer.flush();
        printer.print("d");

        assertEquals(4, printer.column());
    }

    @Test
    void flush_withEmptyBuffer_writesNoChunk() throws IOException {
        var chunks = new ArrayList<String>();
        var recording = BufferedPrinter.create(chunks::add, sourceMap);

        recording.flush();
        recording.print("x");
        recording.flush();
        recording.flush();

        assertEquals(List.of("x"), chunks);
    }

    @Test
    void close_closesSink() throws IOException {
        var closed = new boolean[1];
        var sink = new OutputSink() {
            @Override
            public void write(String chunk) {}

            @Override
            public void close() {
                closed[0] = true;
            }
        };

        try (var p = BufferedPrinter.create(sink, sourceMap)) {
            p.print("x");
        }

        assertTrue(closed[0]);
    }

    @Test
    void makeImportPath_delegatesToRewriter() {
        var rewriting = BufferedPrinter.create(OutputSink.toStringBuilder(out),
                                               sourceMap,
                                               path -> "pkg." + path,
                                               PrinterConfig.DEFAULT);

        assertEquals("pkg.util", rewriting.makeImportPath("util"));
    }
}
