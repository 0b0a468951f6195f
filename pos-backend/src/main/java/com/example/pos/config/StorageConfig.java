package com.example.pos.config;

import com.example.pos.config.props.StorageProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Embedded SQLite store behind a pool of exactly one connection. A transaction keeps the
 * connection from begin to commit or rollback, so concurrent requests take turns and never
 * share a half-finished transaction. Every repository goes through the
 * {@link org.springframework.jdbc.core.JdbcTemplate} built on this data source.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);
    private static final String SQLITE_DRIVER = "org.sqlite.JDBC";
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";
    private static final String POOL_NAME = "pos-store";

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(StorageProperties props) throws IOException {
        String url = resolveUrl(props);
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);

        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName(POOL_NAME);
        cfg.setDriverClassName(SQLITE_DRIVER);
        cfg.setJdbcUrl(url);
        cfg.setDataSourceProperties(sqlite.toProperties());
        cfg.setMaximumPoolSize(1);
        cfg.setMinimumIdle(1);
        // never retire the connection; an in-memory store lives only as long as it does
        cfg.setMaxLifetime(0);
        cfg.setConnectionTimeout(props.getConnectionTimeout());
        log.info("Embedded store at {}", url);
        return new HikariDataSource(cfg);
    }

    static String resolveUrl(StorageProperties props) throws IOException {
        if (StringUtils.hasText(props.getUrl())) {
            return props.getUrl().trim();
        }
        Path file = Paths.get(props.getPath()).toAbsolutePath();
        Path parent = file.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            log.info("Created store directory {}", parent);
        }
        return SQLITE_PREFIX + file;
    }
}
