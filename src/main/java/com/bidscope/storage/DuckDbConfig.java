package com.bidscope.storage;

import com.bidscope.config.BidScopeProperties;
import com.bidscope.query.Dimension;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for the DuckDB store that serves the contract dataset.
 *
 * <p>A single DuckDB instance is opened and pooled through HikariCP; the pool size bounds how many
 * queries run against it at once.
 */
@Configuration
public class DuckDbConfig {
    private static final Logger logger = LoggerFactory.getLogger(DuckDbConfig.class);

    @Value("${bidscope.storage.duckdb.url:jdbc:duckdb:}")
    private String url;

    @Value("${bidscope.storage.duckdb.pool.size:8}")
    private int poolSize;

    @Value("${bidscope.storage.duckdb.threads:0}")
    private int threads;

    @Value("${bidscope.storage.duckdb.memory-limit:}")
    private String memoryLimit;

    @Value("${bidscope.storage.duckdb.query-timeout-seconds:0}")
    private int queryTimeoutSeconds;

    @Bean(name = "duckDbDatabase", destroyMethod = "close")
    public DuckDbDataSource duckDbDatabase() {
        try {
            return new DuckDbDataSource(url, threads, memoryLimit);
        } catch (SQLException e) {
            logger.error("Failed to open DuckDB database {}", url, e);
            throw new IllegalStateException("DuckDB database initialization failed", e);
        }
    }

    /**
     * Pooled connections over the shared DuckDB instance.
     */
    @Primary
    @Bean(name = "duckDbDataSource", destroyMethod = "close")
    public DataSource duckDbDataSource(@Qualifier("duckDbDatabase") DuckDbDataSource database) {
        HikariConfig config = new HikariConfig();
        config.setDataSource(database);
        config.setPoolName("bidscope-duckdb");
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        config.setConnectionTestQuery("SELECT 1");

        HikariDataSource dataSource = new HikariDataSource(config);
        logger.info("DuckDB pool initialized: {} (max {} connections)", url, poolSize);
        return dataSource;
    }

    @Bean(name = "duckDbJdbcTemplate")
    public JdbcTemplate duckDbJdbcTemplate(@Qualifier("duckDbDataSource") DataSource dataSource) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        if (queryTimeoutSeconds > 0) {
            jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
        }
        return jdbcTemplate;
    }

    @Bean(name = "duckDbTransactionManager")
    public DataSourceTransactionManager duckDbTransactionManager(@Qualifier("duckDbDataSource") DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    /**
     * Runs the several physical queries of one engine call on a single connection and transaction,
     * so they all read the same snapshot.
     */
    @Bean(name = "duckDbTransactionTemplate")
    public TransactionTemplate duckDbTransactionTemplate(DataSourceTransactionManager duckDbTransactionManager) {
        return new TransactionTemplate(duckDbTransactionManager);
    }

    @Bean
    public DatasetCatalog datasetCatalog(BidScopeProperties properties) {
        BidScopeProperties.Dataset dataset = properties.getDataset();
        Map<Dimension, String> snapshots = new EnumMap<>(Dimension.class);
        dataset.getSnapshotRelations().forEach((key, relation) -> snapshots.put(Dimension.fromValue(key), relation));
        return new DatasetCatalog(dataset.getPrimaryRelation(), dataset.getExtendedRelation(), snapshots);
    }

    @Bean(initMethod = "validateIfEnabled")
    public DatasetSchemaValidator datasetSchemaValidator(@Qualifier("duckDbJdbcTemplate") JdbcTemplate jdbcTemplate,
                                                         DatasetCatalog catalog,
                                                         BidScopeProperties properties) {
        return new DatasetSchemaValidator(jdbcTemplate, catalog, properties.getDataset().isValidateOnStartup());
    }
}
