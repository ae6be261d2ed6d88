package org.pragmatica.pyprinter.printer;

import org.pragmatica.pyprinter.error.Diagnostics;
import org.pragmatica.pyprinter.sourcemap.SourceMapGenerator;
import org.pragmatica.pyprinter.tree.PyModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.BooleanSupplier;

/**
 * Prints a whole module: the leading import block, then every declaration separated by a blank line.
 *
 * <p>Output reaches the sink in chunks, once after the import block and once after each
 * declaration. Cancellation is checked before every declaration, so a cancelled run leaves
 * only complete declarations in the sink.
 */
public final class ModulePrinter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModulePrinter.class);

    private final PrinterConfig config;
    private final ImportPathRewriter importPaths;

    private ModulePrinter(PrinterConfig config, ImportPathRewriter importPaths) {
        this.config = config;
        this.importPaths = importPaths;
    }

    public static ModulePrinter create() {
        return new ModulePrinter(PrinterConfig.DEFAULT, ImportPathRewriter.identity());
    }

    public static ModulePrinter create(PrinterConfig config, ImportPathRewriter importPaths) {
        return new ModulePrinter(config, importPaths);
    }

    public PrintOutcome run(PyModule module, OutputSink sink, SourceMapGenerator sourceMap) throws IOException {
        return run(module, sink, sourceMap, () -> false);
    }

    /**
     * Print {@code module} into {@code sink}. The sink is closed on every exit path.
     *
     * @param cancelled polled before each declaration; printing stops once it returns true
     * @throws IOException if the sink fails
     * @throws org.pragmatica.pyprinter.error.TranslationException on an untranslatable node
     *         under {@link org.pragmatica.pyprinter.error.FailurePolicy#ABORT}
     */
    public PrintOutcome run(PyModule module,
                            OutputSink sink,
                            SourceMapGenerator sourceMap,
                            BooleanSupplier cancelled) throws IOException {
        var diagnostics = Diagnostics.create(config.failurePolicy());
        var imports = module.imports();
        var declarations = module.declarations();

        LOGGER.debug("Printing module: {} imports, {} declarations", imports.size(), declarations.size());

        try (var printer = BufferedPrinter.create(sink, sourceMap, importPaths, config)) {
            var dispatch = PrintDispatch.create(printer, diagnostics);

            if (!imports.isEmpty()) {
                for (var stmt : imports) {
                    dispatch.printStatement(stmt);
                    endLine(printer);
                }
                printer.newline();
                printer.flush();
            }

            int printed = 0;
            for (var decl : declarations) {
                if (cancelled.getAsBoolean()) {
                    LOGGER.debug("Printing cancelled after {} of {} declarations", printed, declarations.size());
                    return new PrintOutcome(diagnostics.drain(), printed, declarations.size(), true);
                }
                dispatch.printStatement(decl);
                endLine(printer);
                printer.newline();
                printer.flush();
                printed++;
            }

            var outcome = new PrintOutcome(diagnostics.drain(), printed, declarations.size(), false);
            LOGGER.debug("Printed module ending at line {} with {} errors", printer.line(), outcome.errorCount());
            return outcome;
        }
    }

    private static void endLine(Printer printer) {
        if (printer.column() > 0) {
            printer.newline();
        }
    }
}
