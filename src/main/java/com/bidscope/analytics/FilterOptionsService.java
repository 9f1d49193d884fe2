package com.bidscope.analytics;

import com.bidscope.domain.FilterOptions;
import com.bidscope.error.BackingStoreException;
import com.bidscope.filter.FilterSpec;
import com.bidscope.query.Column;
import com.bidscope.query.QueryCompiler;
import com.bidscope.query.QueryMetrics;
import com.bidscope.query.QueryPlan;
import com.bidscope.query.QueryTarget;
import com.bidscope.query.SqlFragment;
import com.bidscope.query.SqlRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Lists the distinct values each chip filter can take, for populating pickers.
 */
@Service
public class FilterOptionsService {

    private static final Logger log = LoggerFactory.getLogger(FilterOptionsService.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlRenderer renderer;
    private final QueryCompiler compiler;
    private final QueryMetrics metrics;

    public FilterOptionsService(@Qualifier("duckDbJdbcTemplate") JdbcTemplate jdbcTemplate,
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

    public FilterOptions options(boolean includeExtended) {
        QueryPlan plan = compiler.compile(FilterSpec.builder().includeExtended(includeExtended).build(),
            QueryTarget.SEARCH);
        SqlFragment filtered = renderer.renderFiltered(plan);

        try {
            FilterOptions options = transactionTemplate.execute(status -> {
                FilterOptions o = new FilterOptions();
                o.setContractors(distinct(filtered, Column.AWARDEE_NAME));
                o.setAreas(distinct(filtered, Column.AREA_OF_DELIVERY));
                o.setOrganizations(distinct(filtered, Column.ORGANIZATION_NAME));
                o.setBusinessCategories(distinct(filtered, Column.BUSINESS_CATEGORY));
                SqlFragment years = filtered.wrap(
                    "SELECT DISTINCT year(award_date) AS y FROM filtered WHERE award_date IS NOT NULL ORDER BY y DESC");
                o.setYears(jdbcTemplate.queryForList(years.getSql(), Integer.class, years.paramArray()));
                return o;
            });
            metrics.recordQueryExecuted();
            log.info("Loaded filter options: {} contractors, {} areas, {} organizations, {} categories",
                options.getContractors().size(), options.getAreas().size(),
                options.getOrganizations().size(), options.getBusinessCategories().size());
            return options;
        } catch (DataAccessException | TransactionException e) {
            metrics.recordQueryFailed();
            log.error("Failed to load filter options", e);
            throw new BackingStoreException("Failed to load filter options", "filter_options", e);
        }
    }

    private List<String> distinct(SqlFragment filtered, Column column) {
        String name = column.getName();
        SqlFragment sql = filtered.wrap("SELECT DISTINCT " + name + " FROM filtered WHERE " + name
            + " IS NOT NULL AND trim(" + name + ") <> '' ORDER BY " + name);
        return jdbcTemplate.queryForList(sql.getSql(), String.class, sql.paramArray());
    }
}
