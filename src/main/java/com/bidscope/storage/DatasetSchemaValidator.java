package com.bidscope.storage;

import com.bidscope.error.BackingStoreException;
import com.bidscope.query.Dimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Verifies that every relation in the {@link DatasetCatalog} exposes the expected columns.
 *
 * <p>Run once at startup. Drift in the ETL output stops the service instead of letting queries
 * read mismatched columns. Extra columns are allowed.
 */
public class DatasetSchemaValidator {
    private static final Logger logger = LoggerFactory.getLogger(DatasetSchemaValidator.class);

    private final JdbcTemplate jdbcTemplate;
    private final DatasetCatalog catalog;
    private final boolean enabled;

    public DatasetSchemaValidator(JdbcTemplate jdbcTemplate, DatasetCatalog catalog, boolean enabled) {
        this.jdbcTemplate = jdbcTemplate;
        this.catalog = catalog;
        this.enabled = enabled;
    }

    /**
     * Startup hook; skipped when validation is switched off.
     */
    public void validateIfEnabled() {
        if (!enabled) {
            logger.warn("Dataset schema validation is disabled");
            return;
        }
        validate();
    }

    public void validate() {
        long start = System.currentTimeMillis();
        check(catalog.getPrimaryRelation(), DatasetCatalog.CONTRACT_COLUMNS);
        check(catalog.getExtendedRelation(), DatasetCatalog.CONTRACT_COLUMNS);
        for (Dimension dimension : Dimension.values()) {
            check(catalog.getSnapshotRelation(dimension), DatasetCatalog.requiredSnapshotColumns(dimension));
        }
        logger.info("Dataset schema validated in {}ms", System.currentTimeMillis() - start);
    }

    Set<String> columnsOf(String relation) {
        try {
            return jdbcTemplate.query("SELECT * FROM " + relation + " LIMIT 0", rs -> {
                ResultSetMetaData metaData = rs.getMetaData();
                Set<String> columns = new LinkedHashSet<>();
                for (int i = 1; i <= metaData.getColumnCount(); i++) {
                    columns.add(metaData.getColumnName(i).toLowerCase(Locale.ROOT));
                }
                return columns;
            });
        } catch (DataAccessException e) {
            throw new BackingStoreException("Relation is not readable", "schema_validation", relation, e);
        }
    }

    private void check(String relation, List<String> required) {
        Set<String> actual = columnsOf(relation);
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!actual.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            logger.error("Schema drift in {}: missing {}", relation, missing);
            throw new SchemaMismatchException(relation, missing);
        }
        logger.debug("Relation {} exposes {} columns", relation, actual.size());
    }
}
