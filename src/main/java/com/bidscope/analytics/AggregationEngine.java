package com.bidscope.analytics;

import com.bidscope.domain.AggregateResult;
import com.bidscope.domain.AggregateSummary;
import com.bidscope.domain.DimensionRow;
import com.bidscope.domain.EntityAggregate;
import com.bidscope.domain.PagedResult;
import com.bidscope.domain.Pagination;
import com.bidscope.domain.TimeBucket;
import com.bidscope.error.BackingStoreException;
import com.bidscope.filter.TimeRange;
import com.bidscope.query.Dimension;
import com.bidscope.query.QueryCompiler;
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
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;

/**
 * Executes aggregate plans: summary, time series and per-dimension breakdowns, paged dimension
 * tables, per-entity listings and drill-downs.
 *
 * <p>Each public call may issue several physical queries but runs them inside one transaction on
 * one connection, so every part of a result is computed from the same filtered set. Sums are
 * decimal; averages are derived from the sum and count and are zero for an empty group.
 */
@Service
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    static final int AVERAGE_SCALE = 2;

    /**
     * Sort keys for paged dimension tables.
     */
    public enum DimensionSort {
        TOTAL_VALUE("total_value", "total"),
        COUNT("count", "cnt"),
        AVG_VALUE("avg_value", "total / cnt");

        private final String value;
        private final String expression;

        DimensionSort(String value, String expression) {
            this.value = value;
            this.expression = expression;
        }

        public String getValue() {
            return value;
        }

        String getExpression() {
            return expression;
        }

        public static DimensionSort fromValue(String value) {
            for (DimensionSort sort : values()) {
                if (sort.value.equalsIgnoreCase(value)) {
                    return sort;
                }
            }
            throw new IllegalArgumentException("Unknown sort field: " + value);
        }
    }

    /**
     * Sort keys for entity listings.
     */
    public enum EntitySort {
        TOTAL_VALUE("total_value", "total_contract_value"),
        COUNT("count", "contract_count"),
        AVG_VALUE("avg_value", "total_contract_value / contract_count"),
        LABEL("label", "entity"),
        FIRST_DATE("first_date", "first_contract_date"),
        LAST_DATE("last_date", "last_contract_date");

        private final String value;
        private final String expression;

        EntitySort(String value, String expression) {
            this.value = value;
            this.expression = expression;
        }

        public String getValue() {
            return value;
        }

        String getExpression() {
            return expression;
        }

        public static EntitySort fromValue(String value) {
            for (EntitySort sort : values()) {
                if (sort.value.equalsIgnoreCase(value)) {
                    return sort;
                }
            }
            switch (value == null ? "" : value.toLowerCase()) {
                case "contract_count":
                    return COUNT;
                case "total_contract_value":
                    return TOTAL_VALUE;
                case "average_contract_value":
                    return AVG_VALUE;
                case "entity":
                    return LABEL;
                default:
                    throw new IllegalArgumentException("Unknown sort field: " + value);
            }
        }
    }

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlRenderer renderer;
    private final QueryCompiler compiler;
    private final QueryMetrics metrics;

    public AggregationEngine(@Qualifier("duckDbJdbcTemplate") JdbcTemplate jdbcTemplate,
                             @Qualifier("duckDbTransactionTemplate") TransactionTemplate transactionTemplate,
                             SqlRenderer renderer,
                             QueryCompiler compiler,
                             QueryMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.renderer = renderer;
        this.compiler = compiler;
        this.metrics = metrics;
    }

    // ========== Full aggregate ==========

    /**
     * Compute summary, yearly and monthly series, and the top {@code topN} entities of every
     * dimension by total value. Entities with a NULL label are left out of the breakdowns.
     */
    public AggregateResult aggregate(QueryPlan plan, int topN) {
        SqlFragment filtered = renderer.renderFiltered(plan);

        Timer.Sample sample = metrics.startTimer();
        try {
            AggregateResult result = transactionTemplate.execute(status -> {
                AggregateResult r = new AggregateResult();
                r.setSummary(querySummary(filtered));
                r.setByYear(queryByYear(filtered));
                r.setByMonth(queryByMonth(filtered));
                r.setByContractor(queryTopDimension(filtered, Dimension.CONTRACTOR, topN));
                r.setByOrganization(queryTopDimension(filtered, Dimension.ORGANIZATION, topN));
                r.setByArea(queryTopDimension(filtered, Dimension.AREA, topN));
                r.setByCategory(queryTopDimension(filtered, Dimension.CATEGORY, topN));
                return r;
            });
            metrics.recordQueryExecuted();
            log.debug("Aggregated {} contracts (total {})", result.getSummary().getCount(),
                result.getSummary().getTotalValue());
            return result;
        } catch (DataAccessException | TransactionException e) {
            metrics.recordQueryFailed();
            log.error("Aggregate query failed", e);
            throw new BackingStoreException("Aggregate query failed", "aggregate", filtered.getSql(), e);
        } finally {
            metrics.recordAggregateLatency(sample);
        }
    }

    private AggregateSummary querySummary(SqlFragment filtered) {
        SqlFragment sql = filtered.wrap(
            "SELECT COUNT(*) AS cnt, COALESCE(SUM(contract_amount), 0) AS total FROM filtered");
        return jdbcTemplate.queryForObject(sql.getSql(), (rs, rowNum) -> {
            long count = rs.getLong("cnt");
            BigDecimal total = rs.getBigDecimal("total");
            return new AggregateSummary(count, total, average(total, count));
        }, sql.paramArray());
    }

    private List<TimeBucket> queryByYear(SqlFragment filtered) {
        SqlFragment sql = filtered.wrap(
            "SELECT year(award_date) AS y, COUNT(*) AS cnt, COALESCE(SUM(contract_amount), 0) AS total " +
            "FROM filtered WHERE award_date IS NOT NULL GROUP BY y ORDER BY y");
        return jdbcTemplate.query(sql.getSql(),
            (rs, rowNum) -> new TimeBucket(rs.getInt("y"), null, rs.getLong("cnt"), rs.getBigDecimal("total")),
            sql.paramArray());
    }

    private List<TimeBucket> queryByMonth(SqlFragment filtered) {
        SqlFragment sql = filtered.wrap(
            "SELECT year(award_date) AS y, month(award_date) AS m, COUNT(*) AS cnt, " +
            "COALESCE(SUM(contract_amount), 0) AS total " +
            "FROM filtered WHERE award_date IS NOT NULL GROUP BY y, m ORDER BY y, m");
        return jdbcTemplate.query(sql.getSql(),
            (rs, rowNum) -> new TimeBucket(rs.getInt("y"), rs.getInt("m"), rs.getLong("cnt"), rs.getBigDecimal("total")),
            sql.paramArray());
    }

    private List<DimensionRow> queryTopDimension(SqlFragment filtered, Dimension dimension, int topN) {
        SqlFragment sql = filtered.wrap(groupedDimensionCte(dimension)
            + " SELECT label, cnt, total FROM grouped ORDER BY total DESC, label ASC LIMIT " + topN);
        return jdbcTemplate.query(sql.getSql(), new DimensionRowMapper(), sql.paramArray());
    }

    // ========== Paged dimension table ==========

    /**
     * One page of a dimension breakdown, sorted by the requested key and then by label ascending.
     */
    public PagedResult<DimensionRow> aggregateDimensionPaged(QueryPlan plan, Dimension dimension,
                                                             PageRequest<DimensionSort> pageRequest) {
        SqlFragment filtered = renderer.renderFiltered(plan);
        String cte = groupedDimensionCte(dimension);
        SqlFragment countSql = filtered.wrap(cte + " SELECT COUNT(*) FROM grouped");
        SqlFragment pageSql = filtered.wrap(cte
            + " SELECT label, cnt, total FROM grouped ORDER BY "
            + pageRequest.getSortBy().getExpression() + " " + pageRequest.getDirection().toSql()
            + ", label ASC LIMIT " + pageRequest.getPageSize() + " OFFSET " + pageRequest.getOffset());

        Timer.Sample sample = metrics.startTimer();
        try {
            PagedResult<DimensionRow> result = transactionTemplate.execute(status -> {
                Long total = jdbcTemplate.queryForObject(countSql.getSql(), Long.class, countSql.paramArray());
                List<DimensionRow> rows = jdbcTemplate.query(pageSql.getSql(), new DimensionRowMapper(),
                    pageSql.paramArray());
                return new PagedResult<>(rows,
                    Pagination.of(pageRequest.getPage(), pageRequest.getPageSize(), total == null ? 0 : total));
            });
            metrics.recordQueryExecuted();
            metrics.recordResultSize(result.getData().size());
            return result;
        } catch (DataAccessException | TransactionException e) {
            metrics.recordQueryFailed();
            log.error("Paged {} aggregate failed", dimension.getResultKey(), e);
            throw new BackingStoreException("Paged dimension aggregate failed", "aggregate_paged", pageSql.getSql(), e);
        } finally {
            metrics.recordAggregateLatency(sample);
        }
    }

    public static String groupedDimensionCte(Dimension dimension) {
        String column = dimension.getColumn().getName();
        return ", grouped AS (SELECT " + column + " AS label, COUNT(*) AS cnt, " +
            "COALESCE(SUM(contract_amount), 0) AS total FROM filtered WHERE " + column +
            " IS NOT NULL GROUP BY " + column + ")";
    }

    // ========== Entity listings ==========

    /**
     * Page through entities of the plan's dimension. Snapshot plans read precomputed rows;
     * contract plans group the filtered records on the fly. Both produce the same columns.
     */
    public PagedResult<EntityAggregate> entityPage(QueryPlan plan, PageRequest<EntitySort> pageRequest) {
        SqlFragment filtered = renderer.renderFiltered(plan);
        String cte = entityCte(plan);
        SqlFragment countSql = filtered.wrap(cte + " SELECT COUNT(*) FROM entities");
        SqlFragment pageSql = filtered.wrap(cte
            + " SELECT * FROM entities ORDER BY " + pageRequest.getSortBy().getExpression() + " "
            + pageRequest.getDirection().toSql() + " NULLS LAST, entity ASC"
            + " LIMIT " + pageRequest.getPageSize() + " OFFSET " + pageRequest.getOffset());

        Timer.Sample sample = metrics.startTimer();
        try {
            PagedResult<EntityAggregate> result = transactionTemplate.execute(status -> {
                Long total = jdbcTemplate.queryForObject(countSql.getSql(), Long.class, countSql.paramArray());
                List<EntityAggregate> rows = jdbcTemplate.query(pageSql.getSql(),
                    new EntityAggregateRowMapper(plan.getDimension()), pageSql.paramArray());
                return new PagedResult<>(rows,
                    Pagination.of(pageRequest.getPage(), pageRequest.getPageSize(), total == null ? 0 : total));
            });
            metrics.recordQueryExecuted();
            log.debug("Entity listing for {} from {} returned {} rows", plan.getDimension().getValue(),
                plan.getSource(), result.getData().size());
            return result;
        } catch (DataAccessException | TransactionException e) {
            metrics.recordQueryFailed();
            log.error("Entity listing for {} failed", plan.getDimension().getValue(), e);
            throw new BackingStoreException("Entity listing failed", "entities", pageSql.getSql(), e);
        } finally {
            metrics.recordAggregateLatency(sample);
        }
    }

    /**
     * Drill-down: entities of {@code targetDimension} among contracts whose
     * {@code sourceDimension} is exactly {@code sourceValue}, by total value descending.
     */
    public List<EntityAggregate> relatedEntities(Dimension sourceDimension, String sourceValue,
                                                 Dimension targetDimension, int limit,
                                                 List<TimeRange> timeRanges, boolean includeExtended) {
        QueryPlan plan = compiler.compileRelated(sourceDimension, sourceValue, targetDimension, timeRanges,
            includeExtended);
        SqlFragment sql = renderer.renderFiltered(plan).wrap(entityCte(plan)
            + " SELECT * FROM entities ORDER BY total_contract_value DESC, entity ASC LIMIT " + limit);

        Timer.Sample sample = metrics.startTimer();
        try {
            List<EntityAggregate> rows = jdbcTemplate.query(sql.getSql(),
                new EntityAggregateRowMapper(targetDimension), sql.paramArray());
            metrics.recordQueryExecuted();
            return rows;
        } catch (DataAccessException e) {
            metrics.recordQueryFailed();
            log.error("Related {} for {} '{}' failed", targetDimension.getValue(), sourceDimension.getValue(),
                sourceValue, e);
            throw new BackingStoreException("Related entity query failed", "related", sql.getSql(), e);
        } finally {
            metrics.recordAggregateLatency(sample);
        }
    }

    /**
     * CTE named {@code entities} with one row per entity and the columns
     * entity, contract_count, total_contract_value, first_contract_date, last_contract_date
     * and the related distinct counts.
     */
    private static String entityCte(QueryPlan plan) {
        Dimension dimension = plan.getDimension();
        StringBuilder sb = new StringBuilder(", entities AS (SELECT ");

        if (plan.isSnapshot()) {
            sb.append("entity, CAST(contract_count AS BIGINT) AS contract_count, ")
                .append("TRY_CAST(total_contract_value AS DECIMAL(38,2)) AS total_contract_value, ")
                .append("TRY_CAST(first_contract_date AS DATE) AS first_contract_date, ")
                .append("TRY_CAST(last_contract_date AS DATE) AS last_contract_date");
            for (Dimension other : Dimension.values()) {
                if (other != dimension) {
                    sb.append(", CAST(").append(other.getCountColumn()).append(" AS BIGINT) AS ")
                        .append(other.getCountColumn());
                }
            }
            return sb.append(" FROM filtered WHERE entity IS NOT NULL)").toString();
        }

        String column = dimension.getColumn().getName();
        sb.append(column).append(" AS entity, COUNT(*) AS contract_count, ")
            .append("COALESCE(SUM(contract_amount), 0) AS total_contract_value, ")
            .append("MIN(award_date) AS first_contract_date, MAX(award_date) AS last_contract_date");
        for (Dimension other : Dimension.values()) {
            if (other != dimension) {
                sb.append(", COUNT(DISTINCT ").append(other.getColumn().getName()).append(") AS ")
                    .append(other.getCountColumn());
            }
        }
        return sb.append(" FROM filtered WHERE ").append(column).append(" IS NOT NULL GROUP BY ")
            .append(column).append(")").toString();
    }

    public static BigDecimal average(BigDecimal total, long count) {
        if (count == 0 || total == null) {
            return BigDecimal.ZERO;
        }
        return total.divide(BigDecimal.valueOf(count), AVERAGE_SCALE, RoundingMode.HALF_UP);
    }

    private static class DimensionRowMapper implements RowMapper<DimensionRow> {
        @Override
        public DimensionRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            long count = rs.getLong("cnt");
            BigDecimal total = rs.getBigDecimal("total");
            return new DimensionRow(rs.getString("label"), count, total, average(total, count));
        }
    }

    private static class EntityAggregateRowMapper implements RowMapper<EntityAggregate> {
        private final Dimension dimension;

        EntityAggregateRowMapper(Dimension dimension) {
            this.dimension = dimension;
        }

        @Override
        public EntityAggregate mapRow(ResultSet rs, int rowNum) throws SQLException {
            EntityAggregate aggregate = new EntityAggregate();
            aggregate.setEntity(rs.getString("entity"));
            long count = rs.getLong("contract_count");
            BigDecimal total = rs.getBigDecimal("total_contract_value");
            if (total == null) {
                total = BigDecimal.ZERO;
            }
            aggregate.setContractCount(count);
            aggregate.setTotalValue(total);
            aggregate.setAverageValue(average(total, count));
            aggregate.setFirstContractDate(toLocalDate(rs.getDate("first_contract_date")));
            aggregate.setLastContractDate(toLocalDate(rs.getDate("last_contract_date")));

            for (Dimension other : Dimension.values()) {
                if (other == dimension) {
                    continue;
                }
                long related = rs.getLong(other.getCountColumn());
                switch (other) {
                    case CONTRACTOR -> aggregate.setContractorCount(related);
                    case ORGANIZATION -> aggregate.setOrganizationCount(related);
                    case AREA -> aggregate.setAreaCount(related);
                    case CATEGORY -> aggregate.setCategoryCount(related);
                }
            }
            return aggregate;
        }

        private static LocalDate toLocalDate(Date date) {
            return date == null ? null : date.toLocalDate();
        }
    }
}
