package com.dbbridge.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration class for DbBridge application settings
 */
@Configuration
@ConfigurationProperties(prefix = "dbbridge")
@Data
public class DbBridgeConfiguration {

    /**
     * Schema whose tables are listed on PostgreSQL connections
     */
    private String postgresSchema = "public";

    /**
     * Query configuration settings
     */
    private QueryConfig query = new QueryConfig();

    /**
     * Connection pool settings for backends that pool (PostgreSQL)
     */
    private PoolConfig pool = new PoolConfig();

    @Data
    public static class QueryConfig {
        /**
         * Maximum number of rows fetched per query, 0 for no limit
         */
        private int maxResultSize = 0;

        /**
         * JDBC statement timeout in seconds, 0 for no timeout
         */
        private int timeoutSeconds = 0;
    }

    @Data
    public static class PoolConfig {
        private int maximumPoolSize = 4;

        /**
         * How long to wait for a pooled connection, in milliseconds
         */
        private long connectionTimeoutMs = 10_000;
    }
}
