package org.pragmatica.pyprinter;

import org.pragmatica.pyprinter.error.FailurePolicy;
import org.pragmatica.pyprinter.printer.ImportPathRewriter;
import org.pragmatica.pyprinter.printer.ModulePrinter;
import org.pragmatica.pyprinter.printer.OutputSink;
import org.pragmatica.pyprinter.printer.PrintOutcome;
import org.pragmatica.pyprinter.printer.PrinterConfig;
import org.pragmatica.pyprinter.sourcemap.RecordingSourceMap;
import org.pragmatica.pyprinter.sourcemap.SourceMapGenerator;
import org.pragmatica.pyprinter.tree.PyModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Entry point for printing target syntax trees as Python source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = PyPrinter.print(PyModule.of(
 *     Statement.importNames("math"),
 *     Statement.assign(Expression.name("x"), Expression.constant(42))));
 *
 * result.source();   // "import math\n\nx = 42\n\n"
 * }</pre>
 */
public final class PyPrinter {
    private PyPrinter() {}

    /**
     * Print a module in memory with default configuration.
     */
    public static PrintResult print(PyModule module) {
        return print(module, PrinterConfig.DEFAULT, ImportPathRewriter.identity());
    }

    /**
     * Print a module in memory.
     */
    public static PrintResult print(PyModule module, PrinterConfig config, ImportPathRewriter importPaths) {
        var source = new StringBuilder();
        var sourceMap = new RecordingSourceMap();
        try {
            var outcome = ModulePrinter.create(config, importPaths)
                                       .run(module, OutputSink.toStringBuilder(source), sourceMap);
            return new PrintResult(source.toString(), sourceMap.mappings(), outcome.diagnostics());
        } catch (IOException e) {
            // A StringBuilder sink does not fail
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Print a module to a writer with default configuration. The writer is closed afterwards.
     */
    public static PrintOutcome print(PyModule module, Writer writer, SourceMapGenerator sourceMap) throws IOException {
        return ModulePrinter.create()
                            .run(module, OutputSink.toWriter(writer), sourceMap);
    }

    /**
     * Create a builder for more complex printer configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String indentUnit = PrinterConfig.DEFAULT.indentUnit();
        private String lineSeparator = PrinterConfig.DEFAULT.lineSeparator();
        private FailurePolicy failurePolicy = PrinterConfig.DEFAULT.failurePolicy();
        private ImportPathRewriter importPaths = ImportPathRewriter.identity();

        private Builder() {}

        public Builder indent(String unit) {
            this.indentUnit = unit;
            return this;
        }

        public Builder lineSeparator(String separator) {
            this.lineSeparator = separator;
            return this;
        }

        public Builder failurePolicy(FailurePolicy policy) {
            this.failurePolicy = policy;
            return this;
        }

        public Builder importPaths(ImportPathRewriter rewriter) {
            this.importPaths = rewriter;
            return this;
        }

        public ModulePrinter build() {
            var config = new PrinterConfig(indentUnit, lineSeparator, failurePolicy);
            return ModulePrinter.create(config, importPaths);
        }

        /**
         * Build and print {@code module} in memory.
         */
        public PrintResult print(PyModule module) {
            var config = new PrinterConfig(indentUnit, lineSeparator, failurePolicy);
            return PyPrinter.print(module, config, importPaths);
        }
    }
}
