package com.bidscope.export;

import java.io.Flushable;
import java.io.IOException;

/**
 * Destination of delimited-text export output. Each call receives whole lines.
 */
public interface ExportSink extends Flushable {

    void write(String chunk) throws IOException;
}
