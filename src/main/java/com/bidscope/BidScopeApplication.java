package com.bidscope;

import com.bidscope.config.BidScopeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for BidScope.
 *
 * BidScope serves interactive and background analytics over an immutable snapshot of
 * government contract awards:
 * - Composable chip filters compiled to parameterized DuckDB SQL over Parquet
 * - Paginated search, multi-dimensional aggregates and value histograms
 * - Bounded-memory CSV exports with cancellation
 * - Background tasks with progress events, retries and cached results
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(BidScopeProperties.class)
public class BidScopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(BidScopeApplication.class, args);
    }
}
