package org.pragmatica.pyprinter.printer;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;

/**
 * Destination of printed text. Receives ordered chunks; chunk boundaries carry no meaning.
 */
public interface OutputSink extends Closeable {

    void write(String chunk) throws IOException;

    @Override
    default void close() throws IOException {}

    static OutputSink toStringBuilder(StringBuilder target) {
        return target::append;
    }

    /**
     * Sink over a writer. Closing the sink closes the writer.
     */
    static OutputSink toWriter(Writer writer) {
        return new OutputSink() {
            @Override
            public void write(String chunk) throws IOException {
                writer.write(chunk);
                writer.flush();
            }

            @Override
            public void close() throws IOException {
                writer.close();
            }
        };
    }
}
