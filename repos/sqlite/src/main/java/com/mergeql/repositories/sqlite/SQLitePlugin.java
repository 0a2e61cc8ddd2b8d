package com.mergeql.repositories.sqlite;

import com.mergeql.core.FieldRegistry;
import com.mergeql.core.MergeEngine;
import com.mergeql.core.Plugin;
import com.mergeql.core.config.MergeSettings;
import com.mergeql.core.config.StoreConfig;
import com.mergeql.repositories.rdbms.RdbmsMergeEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteDataSource;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Merge engines over SQLite database files. One data source per file, with
 * foreign key enforcement switched on.
 */
public class SQLitePlugin implements Plugin {
    private static final Logger logger = LoggerFactory.getLogger(SQLitePlugin.class);

    private final Map<String, SQLiteDataSource> dataSources = new ConcurrentHashMap<>();
    private final FieldRegistry registry;

    public SQLitePlugin() {
        this(null);
    }

    /**
     * @param registry catalog used instead of the database's own metadata tables, may be null
     */
    public SQLitePlugin(FieldRegistry registry) {
        this.registry = registry;
    }

    @Override
    public MergeEngine createEngine(StoreConfig config, MergeSettings settings) {
        if (!(config instanceof SQLiteConfig)) {
            throw new IllegalArgumentException("Expected an sqlite config but got " + config.type);
        }
        SQLiteConfig c = (SQLiteConfig) config;
        if (c.file.startsWith(":memory:")) {
            // every connection would open a fresh empty database
            throw new IllegalArgumentException("In memory databases cannot be merged through a plugin");
        }
        return new RdbmsMergeEngine(buildDatasource(c), new SQLiteDialect(), settings, registry);
    }

    private SQLiteDataSource buildDatasource(SQLiteConfig c) {
        return dataSources.computeIfAbsent(c.file, file -> {
            SQLiteDataSource dataSource = new SQLiteDataSource();
            dataSource.setUrl("jdbc:sqlite:" + file);
            dataSource.setEnforceForeignKeys(true);
            logger.debug("Opened SQLite data source for {}", file);
            return dataSource;
        });
    }

    @Override
    public void cleanUp() {
        dataSources.clear();
    }
}
