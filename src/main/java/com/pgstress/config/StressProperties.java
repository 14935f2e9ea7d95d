package com.pgstress.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Environment and file level defaults for a stress run, bound from {@code stress.*}.
 *
 * <p>{@code application.yml} resolves each entry from the environment variables
 * the cluster tooling already exports ({@code NUM_TABLES}, {@code DB_HOST_IP},
 * ...) and from an optional {@code .env} file. Command-line flags are merged on
 * top by {@link WorkloadConfiguration#from(StressProperties, org.springframework.boot.ApplicationArguments)}.
 */
@ConfigurationProperties(prefix = "stress")
public record StressProperties(
    @DefaultValue("10") int tables,
    @DefaultValue("1000") int rows,
    @DefaultValue("10") int cols,
    @DefaultValue("1000") int batchSize,
    @DefaultValue("4") int threads,
    @DefaultValue("localhost") String host,
    @DefaultValue("5551") int port,
    @DefaultValue("maborak") String database,
    @DefaultValue("postgres") String user,
    @DefaultValue("") String password,
    @DefaultValue("public") String schema,
    @DefaultValue("5m") Duration statementTimeout,
    @DefaultValue("30s") Duration connectionTimeout,
    String jdbcUrl
) {
}
