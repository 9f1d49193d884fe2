package com.bidscope.analytics;

import com.bidscope.domain.HistogramBin;
import com.bidscope.domain.HistogramResult;
import com.bidscope.error.BackingStoreException;
import com.bidscope.error.ValidationException;
import com.bidscope.query.QueryMetrics;
import com.bidscope.query.QueryPlan;
import com.bidscope.query.SqlFragment;
import com.bidscope.query.SqlRenderer;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Equal-width histogram of contract amounts over a filtered set.
 *
 * <p>Only positive, non-null amounts are binned. The stats pass finds min, max, count and total;
 * the binning pass groups by bin index in the store, so memory stays proportional to the number of
 * bins. A record's bin is {@code clamp(floor((v - min) * numBins / (max - min)) + 1, 1, numBins)},
 * computed from the exact range rather than a rounded width, so the maximum always lands in the
 * last bin. Bin bounds are {@code min + (max - min) * i / numBins}. Every bin from 1 to
 * {@code numBins} is reported, empty ones with a zero count.
 */
@Service
public class HistogramEngine {

    private static final Logger log = LoggerFactory.getLogger(HistogramEngine.class);

    public static final int DEFAULT_NUM_BINS = 1000;
    public static final int MIN_NUM_BINS = 10;
    public static final int MAX_NUM_BINS = 10_000;

    private static final MathContext BOUND_CONTEXT = MathContext.DECIMAL64;

    private static final String BINNABLE = "contract_amount IS NOT NULL AND contract_amount > 0";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlRenderer renderer;
    private final QueryMetrics metrics;

    public HistogramEngine(@Qualifier("duckDbJdbcTemplate") JdbcTemplate jdbcTemplate,
                           @Qualifier("duckDbTransactionTemplate") TransactionTemplate transactionTemplate,
                           SqlRenderer renderer,
                           QueryMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.renderer = renderer;
        this.metrics = metrics;
    }

    public static void validateNumBins(int numBins) {
        if (numBins < MIN_NUM_BINS || numBins > MAX_NUM_BINS) {
            throw new ValidationException("num_bins",
                "Number of bins must be between " + MIN_NUM_BINS + " and " + MAX_NUM_BINS + ", got " + numBins);
        }
    }

    public HistogramResult distribution(QueryPlan plan, int numBins) {
        validateNumBins(numBins);
        SqlFragment filtered = renderer.renderFiltered(plan);

        Timer.Sample sample = metrics.startTimer();
        try {
            HistogramResult result = transactionTemplate.execute(status -> compute(filtered, numBins));
            metrics.recordQueryExecuted();
            log.debug("Histogram over {} contracts in {} bins (width {})", result.getTotalContracts(),
                result.getBins().size(), result.getBinWidth());
            return result;
        } catch (DataAccessException | TransactionException e) {
            metrics.recordQueryFailed();
            log.error("Histogram query failed", e);
            throw new BackingStoreException("Histogram query failed", "distribution", filtered.getSql(), e);
        } finally {
            metrics.recordHistogramLatency(sample);
        }
    }

    private HistogramResult compute(SqlFragment filtered, int numBins) {
        SqlFragment statsSql = filtered.wrap(
            "SELECT COUNT(*) AS cnt, MIN(contract_amount) AS min_value, MAX(contract_amount) AS max_value, " +
            "COALESCE(SUM(contract_amount), 0) AS total FROM filtered WHERE " + BINNABLE);
        Stats stats = jdbcTemplate.queryForObject(statsSql.getSql(), (rs, rowNum) -> new Stats(
            rs.getLong("cnt"), rs.getBigDecimal("min_value"), rs.getBigDecimal("max_value"), rs.getBigDecimal("total")),
            statsSql.paramArray());

        if (stats == null || stats.count == 0) {
            return HistogramResult.empty(numBins);
        }

        if (stats.min.compareTo(stats.max) == 0) {
            List<HistogramBin> single = new ArrayList<>();
            single.add(new HistogramBin(1, stats.min, stats.max, stats.count, stats.total,
                AggregationEngine.average(stats.total, stats.count)));
            return new HistogramResult(stats.min, stats.max, BigDecimal.ZERO, numBins, stats.count, stats.total, single);
        }

        BigDecimal range = stats.max.subtract(stats.min);
        BigDecimal width = range.divide(BigDecimal.valueOf(numBins), BOUND_CONTEXT);

        long[] counts = new long[numBins + 1];
        BigDecimal[] totals = new BigDecimal[numBins + 1];
        SqlFragment binSql = filtered.wrap(
            "SELECT LEAST(GREATEST(CAST(FLOOR((CAST(contract_amount AS DOUBLE) - ?) * ? / ?) AS BIGINT) + 1, 1), ?) " +
            "AS bin_index, COUNT(*) AS cnt, SUM(contract_amount) AS total FROM filtered WHERE " + BINNABLE +
            " GROUP BY bin_index",
            stats.min.doubleValue(), numBins, range.doubleValue(), numBins);
        jdbcTemplate.query(binSql.getSql(), (RowCallbackHandler) rs -> {
            int bin = rs.getInt("bin_index");
            counts[bin] = rs.getLong("cnt");
            totals[bin] = rs.getBigDecimal("total");
        }, binSql.paramArray());

        List<HistogramBin> bins = new ArrayList<>(numBins);
        for (int i = 1; i <= numBins; i++) {
            BigDecimal start = boundary(stats, range, i - 1, numBins);
            BigDecimal end = i == numBins ? stats.max : boundary(stats, range, i, numBins);
            BigDecimal total = totals[i] == null ? BigDecimal.ZERO : totals[i];
            bins.add(new HistogramBin(i, start, end, counts[i], total, AggregationEngine.average(total, counts[i])));
        }
        return new HistogramResult(stats.min, stats.max, width, numBins, stats.count, stats.total, bins);
    }

    private static BigDecimal boundary(Stats stats, BigDecimal range, int index, int numBins) {
        if (index == 0) {
            return stats.min;
        }
        BigDecimal offset = range.multiply(BigDecimal.valueOf(index)).divide(BigDecimal.valueOf(numBins), BOUND_CONTEXT);
        return stats.min.add(offset).min(stats.max);
    }

    private static class Stats {
        final long count;
        final BigDecimal min;
        final BigDecimal max;
        final BigDecimal total;

        Stats(long count, BigDecimal min, BigDecimal max, BigDecimal total) {
            this.count = count;
            this.min = min;
            this.max = max;
            this.total = total;
        }
    }
}
