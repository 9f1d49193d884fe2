package com.bidscope.export;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A finished export file written by a background task. A reader compares {@code rows_written}
 * with {@code expected_rows} to detect a short file.
 */
public class ExportArtifact {

    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("rows_written")
    private long rowsWritten;

    @JsonProperty("expected_rows")
    private long expectedRows;

    @JsonProperty("bytes_written")
    private long bytesWritten;

    public ExportArtifact() {
    }

    public ExportArtifact(String fileName, long rowsWritten, long expectedRows, long bytesWritten) {
        this.fileName = fileName;
        this.rowsWritten = rowsWritten;
        this.expectedRows = expectedRows;
        this.bytesWritten = bytesWritten;
    }

    public String getFileName() {
        return fileName;
    }

    public long getRowsWritten() {
        return rowsWritten;
    }

    public long getExpectedRows() {
        return expectedRows;
    }

    public long getBytesWritten() {
        return bytesWritten;
    }
}
