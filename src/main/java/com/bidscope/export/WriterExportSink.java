package com.bidscope.export;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * {@link ExportSink} over a character writer, counting the UTF-8 bytes passed through.
 */
public class WriterExportSink implements ExportSink {

    private final Writer writer;
    private long bytesWritten;

    public WriterExportSink(Writer writer) {
        this.writer = writer;
    }

    @Override
    public void write(String chunk) throws IOException {
        writer.write(chunk);
        bytesWritten += chunk.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public void flush() throws IOException {
        writer.flush();
    }

    public long getBytesWritten() {
        return bytesWritten;
    }
}
