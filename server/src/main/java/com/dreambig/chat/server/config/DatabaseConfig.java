package com.dreambig.chat.server.config;

import com.dreambig.chat.server.store.SchemaInitializer;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * HikariCP pool for the message store and token lookups.
 */
@Configuration
public class DatabaseConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    @Value("${db.url}")
    private String url;

    @Value("${db.username}")
    private String username;

    @Value("${db.password}")
    private String password;

    @Value("${db.driver:}")
    private String driver;

    @Value("${db.pool.maximumPoolSize:20}")
    private int maximumPoolSize;

    @Value("${db.pool.minimumIdle:5}")
    private int minimumIdle;

    @Value("${db.pool.connectionTimeout:30000}")
    private long connectionTimeout;

    @Value("${db.pool.idleTimeout:600000}")
    private long idleTimeout;

    @Value("${db.pool.maxLifetime:1800000}")
    private long maxLifetime;

    @Value("${db.init-schema:false}")
    private boolean initSchema;

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("chat-db");
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        if (!driver.isBlank()) config.setDriverClassName(driver);

        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(minimumIdle);
        config.setConnectionTimeout(connectionTimeout);
        config.setIdleTimeout(idleTimeout);
        config.setMaxLifetime(maxLifetime);

        config.addDataSourceProperty("cachePrepStmts", "true");
        config.addDataSourceProperty("prepStmtCacheSize", "250");
        config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
        config.addDataSourceProperty("useServerPrepStmts", "true");

        HikariDataSource dataSource = new HikariDataSource(config);
        log.info("[BOOT] database pool initialized: url={}, poolSize={}, minIdle={}", url, maximumPoolSize, minimumIdle);

        if (initSchema) {
            SchemaInitializer.apply(dataSource, "db/schema.sql");
        }
        return dataSource;
    }
}
