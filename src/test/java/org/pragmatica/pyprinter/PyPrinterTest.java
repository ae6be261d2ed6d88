package org.pragmatica.pyprinter;

import org.junit.jupiter.api.Test;
import org.pragmatica.pyprinter.error.FailurePolicy;
import org.pragmatica.pyprinter.error.TranslationException;
import org.pragmatica.pyprinter.sourcemap.RecordingSourceMap;
import org.pragmatica.pyprinter.tree.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PyPrinterTest {

    @Test
    void print_producesSourceAndMappings() {
        var body = List.<Statement>of(Statement.returnValue(
            Expression.binOp(Expression.name("a", SourceLocation.named(2, 11, "a")),
                             BinaryOperator.ADD,
                             Expression.typed(Type.extended(ExtendedNumberKind.INT64), 1L))));
        var module = PyModule.of(Statement.importNames("math"),
                               Statement.function("add", Arguments.of("a"), body));

        var result = PyPrinter.print(module);

        assertEquals("import math\n\n"
                     + "def add(a):\n"
                     + "    return a + (Long.fromBits(1.0, 0.0, False))\n\n\n",
                     result.source());
        assertTrue(result.isSuccess());
        assertEquals(1, result.mappings().size());
        assertEquals(4, result.mappings().get(0).generatedLine());
        assertEquals(11, result.mappings().get(0).generatedColumn());
    }

    @Test
    void print_toWriter_writesAndClosesWriter() throws IOException {
        var closed = new boolean[1];
        var writer = new StringWriter() {
            @Override
            public void close() throws IOException {
                closed[0] = true;
                super.close();
            }
        };
        var sourceMap = new RecordingSourceMap();

        var outcome = PyPrinter.print(PyModule.of(Statement.assign(Expression.name("x"), Expression.constant("y"))),
                                      writer,
                                      sourceMap);

        assertEquals("x = \"y\"\n\n", writer.toString());
        assertTrue(outcome.isSuccess());
        assertTrue(closed[0]);
    }

    @Test
    void builder_appliesConfiguration() {
        var module = PyModule.of(Statement.importFrom("helpers", "run"),
                               Statement.function("main", Arguments.EMPTY, List.of()));

        var result = PyPrinter.builder()
                              .indent("  ")
                              .lineSeparator("\r\n")
                              .importPaths(path -> "." + path)
                              .print(module);

        assertEquals("from .helpers import run\r\n\r\ndef main():\r\n  pass\r\n\r\n\r\n", result.source());
    }

    @Test
    void builder_abortPolicy_throwsOnUnrecognizedLiteral() {
        var module = PyModule.of(Statement.expr(Expression.typed(Type.STRING, 42)));

        assertThrows(TranslationException.class,
                     () -> PyPrinter.builder().failurePolicy(FailurePolicy.ABORT).print(module));
    }

    @Test
    void reportPolicy_keepsPrintingAfterFailure() {
        var module = PyModule.of(Statement.expr(Expression.typed(Type.STRING, 42)),
                               Statement.assign(Expression.name("z"), Expression.constant(0)));

        var result = PyPrinter.print(module);

        assertEquals("None\n\nz = 0\n\n", result.source());
        assertTrue(result.hasErrors());
        assertThat(result.formatDiagnostics("", "Main.fs")).contains("error[E002]");
    }

    @Test
    void builder_build_returnsReusablePrinter() throws IOException {
        var printer = PyPrinter.builder().indent("\t").build();
        var first = new StringBuilder();
        var second = new StringBuilder();
        var module = PyModule.of(Statement.function("f", Arguments.EMPTY, List.of()));

        printer.run(module, org.pragmatica.pyprinter.printer.OutputSink.toStringBuilder(first), (a, b, c, d, e) -> {});
        printer.run(module, org.pragmatica.pyprinter.printer.OutputSink.toStringBuilder(second), (a, b, c, d, e) -> {});

        assertEquals(first.toString(), second.toString());
        assertEquals("def f():\n\tpass\n\n\n", first.toString());
    }

    @Test
    void locationsNeverAffectOutputText() {
        var located = PyModule.of(new Statement.Assign(List.of(Expression.name("x", SourceLocation.at(1, 0))),
                                                     Expression.name("y", SourceLocation.at(1, 4)),
                                                     Optional.of(SourceLocation.at(1, 0))));
        var plain = PyModule.of(Statement.assign(Expression.name("x"), Expression.name("y")));

        assertEquals(PyPrinter.print(plain).source(), PyPrinter.print(located).source());
    }
}
