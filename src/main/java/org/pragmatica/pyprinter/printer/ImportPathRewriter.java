package org.pragmatica.pyprinter.printer;

/**
 * Translates a logical module reference into the import path the output uses.
 * The result is printed verbatim.
 */
@FunctionalInterface
public interface ImportPathRewriter {

    String rewrite(String logicalPath);

    static ImportPathRewriter identity() {
        return path -> path;
    }
}
