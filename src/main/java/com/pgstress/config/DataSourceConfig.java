package com.pgstress.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Builds the run configuration and the shared HikariCP connection pool.
 *
 * <p>The pool is sized {@code threads + 2}: every insert worker owns one
 * connection for a whole table while the coordinating thread still has room to
 * provision, update and query without waiting behind the workers.
 */
@Configuration
@EnableConfigurationProperties(StressProperties.class)
public class DataSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    static final String POOL_NAME = "stress-pool";

    @Bean
    public WorkloadConfiguration workloadConfiguration(StressProperties properties, ApplicationArguments arguments) {
        WorkloadConfiguration configuration = WorkloadConfiguration.from(properties, arguments);
        log.debug("Resolved {}", configuration);
        return configuration;
    }

    /**
     * Creates the connection pool.
     *
     * <p>The pool opens lazily, on the first checkout, so an unreachable server
     * surfaces in the connectivity check rather than during context startup.
     *
     * @param configuration the run configuration
     * @return the pooled data source
     */
    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(WorkloadConfiguration configuration) {
        HikariConfig config = new HikariConfig();
        config.setPoolName(POOL_NAME);
        config.setJdbcUrl(configuration.jdbcUrl());
        config.setUsername(configuration.user());
        config.setPassword(configuration.password());
        config.setMaximumPoolSize(configuration.poolSize());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(configuration.connectionTimeout().toMillis());
        config.setAutoCommit(true);
        log.info("Connection pool {}: {} (max {} connections)",
            POOL_NAME, configuration.jdbcUrl(), configuration.poolSize());
        HikariDataSource dataSource = new HikariDataSource();
        config.copyStateTo(dataSource);
        return dataSource;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(HikariDataSource dataSource, WorkloadConfiguration configuration) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(configuration.queryTimeoutSeconds());
        return jdbcTemplate;
    }

    @Bean
    public PlatformTransactionManager transactionManager(HikariDataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
