package com.mergeql.repositories.postgres;

import com.mergeql.core.FieldRegistry;
import com.mergeql.core.MergeEngine;
import com.mergeql.core.Plugin;
import com.mergeql.core.config.MergeSettings;
import com.mergeql.core.config.StoreConfig;
import com.mergeql.repositories.rdbms.RdbmsMergeEngine;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;
import java.util.HashMap;
import java.util.Map;

/**
 * PostgreSQL plugin implementation.
 * Manages connection pools and creates merge engines over them.
 */
public class PostgresPlugin implements Plugin {
    private final Map<String, HikariDataSource> dataSources = new HashMap<>();
    private final FieldRegistry registry;

    public PostgresPlugin() {
        this(null);
    }

    /**
     * @param registry catalog used instead of the database's own metadata tables, may be null
     */
    public PostgresPlugin(FieldRegistry registry) {
        this.registry = registry;
    }

    @Override
    public MergeEngine createEngine(StoreConfig config, MergeSettings settings) {
        if (!(config instanceof PostgresConfig)) {
            throw new IllegalArgumentException("Expected a postgres config but got " + config.type);
        }
        return new RdbmsMergeEngine(getOrCreateDataSource((PostgresConfig) config), new PostgresDialect(),
                settings, registry);
    }

    @Override
    public synchronized void cleanUp() {
        for (HikariDataSource dataSource : dataSources.values()) {
            dataSource.close();
        }
        dataSources.clear();
    }

    /**
     * Gets or creates a DataSource for the given config.
     * Reuses DataSources for the same connection URL.
     */
    private synchronized DataSource getOrCreateDataSource(PostgresConfig config) {
        if (config.uri == null) {
            throw new IllegalArgumentException("A JDBC url is required");
        }
        return dataSources.computeIfAbsent(config.uri, k -> {
            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(config.uri);

            if (config.username != null) {
                hikariConfig.setUsername(config.username);
            }
            if (config.password != null) {
                hikariConfig.setPassword(config.password);
            }

            hikariConfig.setMaximumPoolSize(config.maxPoolSize);
            hikariConfig.setMinimumIdle(config.minIdle);
            hikariConfig.setPoolName("mergeql-" + dataSources.size());

            return new HikariDataSource(hikariConfig);
        });
    }
}
