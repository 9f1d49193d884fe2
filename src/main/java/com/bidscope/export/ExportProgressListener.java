package com.bidscope.export;

/**
 * Called after each batch has been flushed to the sink.
 */
@FunctionalInterface
public interface ExportProgressListener {

    ExportProgressListener NONE = rowsWritten -> { };

    void onBatchWritten(long rowsWritten);
}
