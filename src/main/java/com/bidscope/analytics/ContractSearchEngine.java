package com.bidscope.analytics;

import com.bidscope.domain.ContractRecord;
import com.bidscope.domain.PagedResult;
import com.bidscope.domain.Pagination;
import com.bidscope.error.BackingStoreException;
import com.bidscope.query.Column;
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

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Paginated listing of individual contract records matching a plan.
 */
@Service
public class ContractSearchEngine {

    private static final Logger log = LoggerFactory.getLogger(ContractSearchEngine.class);

    static final String RECORD_COLUMNS =
        "contract_number, award_title, notice_title, awardee_name, organization_name, " +
        "area_of_delivery, business_category, contract_amount, award_date";

    /**
     * Columns a search may be ordered by.
     */
    public enum SortField {
        AWARD_DATE(Column.AWARD_DATE),
        CONTRACT_AMOUNT(Column.CONTRACT_AMOUNT),
        AWARDEE_NAME(Column.AWARDEE_NAME),
        ORGANIZATION_NAME(Column.ORGANIZATION_NAME),
        AREA_OF_DELIVERY(Column.AREA_OF_DELIVERY),
        BUSINESS_CATEGORY(Column.BUSINESS_CATEGORY),
        CONTRACT_NUMBER(Column.CONTRACT_NUMBER);

        private final Column column;

        SortField(Column column) {
            this.column = column;
        }

        public Column getColumn() {
            return column;
        }

        public static SortField fromValue(String value) {
            for (SortField field : values()) {
                if (field.column.getName().equalsIgnoreCase(value) || field.name().equalsIgnoreCase(value)) {
                    return field;
                }
            }
            if ("contractor".equalsIgnoreCase(value)) {
                return AWARDEE_NAME;
            }
            throw new IllegalArgumentException("Unknown sort field: " + value);
        }
    }

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlRenderer renderer;
    private final QueryMetrics metrics;

    public ContractSearchEngine(@Qualifier("duckDbJdbcTemplate") JdbcTemplate jdbcTemplate,
                                @Qualifier("duckDbTransactionTemplate") TransactionTemplate transactionTemplate,
                                SqlRenderer renderer,
                                QueryMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.renderer = renderer;
        this.metrics = metrics;
    }

    /**
     * Return one page of matching contracts. The total and the page are read in one transaction.
     * Ties in the sort column are broken by contract number so pages never overlap.
     */
    public PagedResult<ContractRecord> search(QueryPlan plan, PageRequest<SortField> pageRequest) {
        SqlFragment filtered = renderer.renderFiltered(plan);
        String column = pageRequest.getSortBy().getColumn().getName();
        String order = column + " " + pageRequest.getDirection().toSql() + " NULLS LAST"
            + (pageRequest.getSortBy() == SortField.CONTRACT_NUMBER ? "" : ", contract_number ASC");

        SqlFragment countSql = filtered.wrap("SELECT COUNT(*) FROM filtered");
        SqlFragment pageSql = filtered.wrap(
            "SELECT " + RECORD_COLUMNS + " FROM filtered ORDER BY " + order
                + " LIMIT " + pageRequest.getPageSize() + " OFFSET " + pageRequest.getOffset());

        Timer.Sample sample = metrics.startTimer();
        try {
            PagedResult<ContractRecord> result = transactionTemplate.execute(status -> {
                Long total = jdbcTemplate.queryForObject(countSql.getSql(), Long.class, countSql.paramArray());
                List<ContractRecord> rows = jdbcTemplate.query(pageSql.getSql(), new ContractRecordRowMapper(),
                    pageSql.paramArray());
                long totalCount = total == null ? 0 : total;
                return new PagedResult<>(rows,
                    Pagination.of(pageRequest.getPage(), pageRequest.getPageSize(), totalCount));
            });
            metrics.recordQueryExecuted();
            metrics.recordResultSize(result.getData().size());
            log.debug("Search returned {} of {} rows ({})", result.getData().size(),
                result.getPagination().getTotalCount(), pageRequest);
            return result;
        } catch (DataAccessException | TransactionException e) {
            metrics.recordQueryFailed();
            log.error("Contract search failed", e);
            throw new BackingStoreException("Contract search failed", "search", pageSql.getSql(), e);
        } finally {
            metrics.recordSearchLatency(sample);
        }
    }

    /**
     * Maps the {@link #RECORD_COLUMNS} projection to {@link ContractRecord}.
     */
    static class ContractRecordRowMapper implements RowMapper<ContractRecord> {
        @Override
        public ContractRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            ContractRecord record = new ContractRecord();
            record.setContractNumber(rs.getString("contract_number"));
            record.setAwardTitle(rs.getString("award_title"));
            record.setNoticeTitle(rs.getString("notice_title"));
            record.setAwardeeName(rs.getString("awardee_name"));
            record.setOrganizationName(rs.getString("organization_name"));
            record.setAreaOfDelivery(rs.getString("area_of_delivery"));
            record.setBusinessCategory(rs.getString("business_category"));
            record.setContractAmount(rs.getBigDecimal("contract_amount"));
            Date awardDate = rs.getDate("award_date");
            record.setAwardDate(awardDate == null ? null : awardDate.toLocalDate());
            return record;
        }
    }
}
