package com.bidscope.export;

import com.bidscope.analytics.AggregationEngine;
import com.bidscope.config.BidScopeProperties;
import com.bidscope.domain.ExportEstimate;
import com.bidscope.error.BackingStoreException;
import com.bidscope.error.CancelledException;
import com.bidscope.query.Dimension;
import com.bidscope.query.QueryMetrics;
import com.bidscope.query.QueryPlan;
import com.bidscope.query.SqlFragment;
import com.bidscope.query.SqlRenderer;
import io.micrometer.core.instrument.Timer;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

/**
 * Bulk CSV export of a filtered contract set, either row by row or aggregated by one dimension.
 *
 * <p>Rows are pulled from a forward-only cursor and buffered into batches of
 * {@code bidscope.export.batch-size}. Each full batch is written and flushed before the next row
 * is read, so memory stays bounded by one batch. The cancellation token is checked after every
 * flush; a cancelled stream stops without error and reports the rows already written. Output
 * flushed before a store failure is not retracted.
 */
@Service
public class ExportPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExportPipeline.class);

    public static final List<String> CONTRACT_HEADER = Arrays.asList(
        "reference_id", "contract_no", "award_title", "notice_title", "awardee_name", "organization_name",
        "area_of_delivery", "business_category", "contract_amount", "award_date", "award_status");

    public static final List<String> AGGREGATE_HEADER = Arrays.asList("label", "total_value", "count", "avg_value");

    static final String AWARD_STATUS = "active";

    private static final String EXPORT_COLUMNS =
        "contract_number, award_title, notice_title, awardee_name, organization_name, " +
        "area_of_delivery, business_category, contract_amount, award_date";

    private final JdbcTemplate jdbcTemplate;
    private final SqlRenderer renderer;
    private final QueryMetrics metrics;
    private final int batchSize;
    private final int averageRowBytes;
    private final int averageAggregateRowBytes;

    public ExportPipeline(@Qualifier("duckDbJdbcTemplate") JdbcTemplate jdbcTemplate,
                          SqlRenderer renderer,
                          QueryMetrics metrics,
                          BidScopeProperties properties) {
        this(jdbcTemplate, renderer, metrics, properties.getExport().getBatchSize(),
            properties.getExport().getAverageRowBytes(), properties.getExport().getAverageAggregateRowBytes());
    }

    ExportPipeline(JdbcTemplate jdbcTemplate, SqlRenderer renderer, QueryMetrics metrics,
                   int batchSize, int averageRowBytes, int averageAggregateRowBytes) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.renderer = renderer;
        this.metrics = metrics;
        this.batchSize = batchSize;
        this.averageRowBytes = averageRowBytes;
        this.averageAggregateRowBytes = averageAggregateRowBytes;
    }

    // ========== Estimates ==========

    /**
     * Row count plus a size guess from the average row width. Costs one COUNT query.
     */
    public ExportEstimate estimate(QueryPlan plan) {
        SqlFragment sql = renderer.renderFiltered(plan).wrap("SELECT COUNT(*) FROM filtered");
        long count = count(sql, "export_estimate");
        long bytes = headerBytes(CONTRACT_HEADER) + count * averageRowBytes;
        return new ExportEstimate(count, bytes);
    }

    public ExportEstimate estimateAggregated(QueryPlan plan, Dimension dimension) {
        String column = dimension.getColumn().getName();
        SqlFragment sql = renderer.renderFiltered(plan).wrap(
            "SELECT COUNT(DISTINCT " + column + ") FROM filtered WHERE " + column + " IS NOT NULL");
        long count = count(sql, "export_aggregated_estimate");
        long bytes = headerBytes(AGGREGATE_HEADER) + count * averageAggregateRowBytes;
        return new ExportEstimate(count, bytes);
    }

    private long count(SqlFragment sql, String operation) {
        try {
            Long count = jdbcTemplate.queryForObject(sql.getSql(), Long.class, sql.paramArray());
            metrics.recordQueryExecuted();
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            metrics.recordQueryFailed();
            log.error("Export estimate failed", e);
            throw new BackingStoreException("Export estimate failed", operation, sql.getSql(), e);
        }
    }

    private static long headerBytes(List<String> header) {
        return CsvFormatter.line(header).length();
    }

    // ========== Streams ==========

    public long stream(QueryPlan plan, ExportSink sink, CancellationToken token) {
        return stream(plan, sink, token, ExportProgressListener.NONE);
    }

    /**
     * Stream every matching contract as CSV, ordered by award date then contract number.
     *
     * @return number of data rows written (the header is not counted)
     */
    public long stream(QueryPlan plan, ExportSink sink, CancellationToken token, ExportProgressListener listener) {
        SqlFragment sql = renderer.renderFiltered(plan).wrap("SELECT " + EXPORT_COLUMNS
            + " FROM filtered ORDER BY award_date DESC NULLS LAST, contract_number ASC");
        return run("export", sql, CONTRACT_HEADER, sink, token, listener, rs -> {
            String contractNumber = rs.getString("contract_number");
            Date awardDate = rs.getDate("award_date");
            return Arrays.asList(
                contractNumber,
                contractNumber,
                rs.getString("award_title"),
                rs.getString("notice_title"),
                rs.getString("awardee_name"),
                rs.getString("organization_name"),
                rs.getString("area_of_delivery"),
                rs.getString("business_category"),
                rs.getBigDecimal("contract_amount"),
                awardDate == null ? null : awardDate.toLocalDate(),
                AWARD_STATUS);
        });
    }

    public long streamAggregated(QueryPlan plan, Dimension dimension, ExportSink sink, CancellationToken token) {
        return streamAggregated(plan, dimension, sink, token, ExportProgressListener.NONE);
    }

    /**
     * Stream one row per non-null entity of {@code dimension}, by total value descending.
     */
    public long streamAggregated(QueryPlan plan, Dimension dimension, ExportSink sink, CancellationToken token,
                                 ExportProgressListener listener) {
        SqlFragment sql = renderer.renderFiltered(plan).wrap(AggregationEngine.groupedDimensionCte(dimension)
            + " SELECT label, cnt, total FROM grouped ORDER BY total DESC, label ASC");
        return run("export_aggregated", sql, AGGREGATE_HEADER, sink, token, listener, rs -> {
            long count = rs.getLong("cnt");
            BigDecimal total = rs.getBigDecimal("total");
            return Arrays.asList(rs.getString("label"), total, count, AggregationEngine.average(total, count));
        });
    }

    private long run(String operation, SqlFragment sql, List<String> header, ExportSink sink,
                     CancellationToken token, ExportProgressListener listener, RecordMapper mapper) {
        Timer.Sample sample = metrics.startTimer();
        BatchWriter batches = new BatchWriter(sink, token, listener, mapper);
        try {
            batches.writeHeader(header);

            if (!token.isCancelled()) {
                jdbcTemplate.query(forwardOnly(sql), batches);
                batches.flushBatch();
            }
            logOutcome(operation, batches.rowsWritten, token);
            return batches.rowsWritten;
        } catch (CancelledException e) {
            logOutcome(operation, batches.rowsWritten, token);
            return batches.rowsWritten;
        } catch (DataAccessException e) {
            metrics.recordQueryFailed();
            log.error("{} failed after {} rows", operation, batches.rowsWritten, e);
            throw new BackingStoreException("Export failed after " + batches.rowsWritten + " rows", operation,
                sql.getSql(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Export sink failed after " + batches.rowsWritten + " rows", e);
        } catch (UncheckedIOException e) {
            log.warn("{} sink closed after {} rows: {}", operation, batches.rowsWritten, e.getMessage());
            throw e;
        } finally {
            metrics.recordExportedRows(batches.rowsWritten);
            metrics.recordExportLatency(sample);
        }
    }

    private void logOutcome(String operation, long rows, CancellationToken token) {
        if (token.isCancelled()) {
            metrics.recordExportCancelled();
            log.info("{} cancelled after {} rows", operation, rows);
        } else {
            metrics.recordQueryExecuted();
            log.info("{} completed: {} rows", operation, rows);
        }
    }

    private PreparedStatementCreator forwardOnly(SqlFragment sql) {
        return con -> {
            PreparedStatement ps = con.prepareStatement(sql.getSql());
            ps.setFetchSize(batchSize);
            new ArgumentPreparedStatementSetter(sql.paramArray()).setValues(ps);
            return ps;
        };
    }

    @FunctionalInterface
    private interface RecordMapper {
        List<?> fields(ResultSet rs) throws SQLException;
    }

    /**
     * Prints records into a buffer and hands them to the sink one batch at a time.
     */
    private class BatchWriter implements RowCallbackHandler {
        private final ExportSink sink;
        private final CancellationToken token;
        private final ExportProgressListener listener;
        private final RecordMapper mapper;
        private final StringBuilder buffer = new StringBuilder();
        private final CSVPrinter printer = CsvFormatter.printer(buffer);
        private int buffered;
        private long rowsWritten;

        BatchWriter(ExportSink sink, CancellationToken token, ExportProgressListener listener, RecordMapper mapper) {
            this.sink = sink;
            this.token = token;
            this.listener = listener;
            this.mapper = mapper;
        }

        void writeHeader(List<String> header) throws IOException {
            CsvFormatter.printRecord(printer, header);
            sink.write(buffer.toString());
            sink.flush();
            buffer.setLength(0);
        }

        @Override
        public void processRow(ResultSet rs) throws SQLException {
            CsvFormatter.printRecord(printer, mapper.fields(rs));
            buffered++;
            if (buffered >= batchSize) {
                flushBatch();
                if (token.isCancelled()) {
                    throw new CancelledException("Export cancelled after " + rowsWritten + " rows");
                }
            }
        }

        void flushBatch() {
            if (buffered == 0) {
                return;
            }
            try {
                sink.write(buffer.toString());
                sink.flush();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            rowsWritten += buffered;
            buffer.setLength(0);
            buffered = 0;
            listener.onBatchWritten(rowsWritten);
        }
    }
}
