package com.bidscope.export;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV dialect of every export: RFC 4180 with minimal quoting and LF record separators. NULL is
 * written as an empty field, amounts in plain notation and dates in ISO format.
 */
public final class CsvFormatter {

    public static final String LINE_SEPARATOR = "\n";

    public static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setRecordSeparator(LINE_SEPARATOR)
        .build();

    private CsvFormatter() {
    }

    public static CSVPrinter printer(Appendable out) {
        try {
            return new CSVPrinter(out, FORMAT);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Print one record, converting amounts and dates to their export text first.
     */
    public static void printRecord(CSVPrinter printer, List<?> fields) {
        List<Object> values = new ArrayList<>(fields.size());
        for (Object field : fields) {
            values.add(exportValue(field));
        }
        try {
            printer.printRecord(values);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Format a single record as one line, separator included.
     */
    public static String line(List<?> fields) {
        StringBuilder sb = new StringBuilder();
        printRecord(printer(sb), fields);
        return sb.toString();
    }

    static Object exportValue(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof LocalDate) {
            return value.toString();
        }
        return value;
    }
}
