package com.mergeql.cli.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mergeql.core.FieldRegistry;
import com.mergeql.core.InMemoryFieldRegistry;
import com.mergeql.core.Plugin;
import com.mergeql.core.config.MergeSettings;
import com.mergeql.core.config.StoreConfig;
import com.mergeql.repositories.postgres.PostgresConfig;
import com.mergeql.repositories.postgres.PostgresDialect;
import com.mergeql.repositories.postgres.PostgresPlugin;
import com.mergeql.repositories.rdbms.SqlDialect;
import com.mergeql.repositories.sqlite.SQLiteConfig;
import com.mergeql.repositories.sqlite.SQLiteDialect;
import com.mergeql.repositories.sqlite.SQLitePlugin;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Where the store is and how it is laid out. Shared by every subcommand.
 */
public class StoreOptions {
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";
    private static final String POSTGRES_PREFIX = "jdbc:postgresql:";

    @Option(names = {"--jdbc-url"}, required = true, description = "JDBC connection URL (sqlite or postgresql)")
    String jdbcUrl;

    @Option(names = {"--username", "-u"}, description = "Database username")
    String username;

    @Option(names = {"--password", "-p"}, description = "Database password")
    String password;

    @Option(names = {"--settings"}, description = "Merge settings JSON (default: built in conventions)")
    File settings;

    @Option(names = {"--catalog"}, description = "Metadata catalog JSON used instead of the store's own catalog tables")
    File catalog;

    MergeSettings settings(ObjectMapper mapper) throws IOException {
        return settings != null ? mapper.readValue(settings, MergeSettings.class) : MergeSettings.defaults();
    }

    /**
     * The catalog file's registry, or null when the store's catalog tables are to be read.
     */
    FieldRegistry registry(ObjectMapper mapper) throws IOException {
        return catalog != null ? mapper.readValue(catalog, InMemoryFieldRegistry.class) : null;
    }

    boolean isSqlite() {
        if (jdbcUrl.startsWith(SQLITE_PREFIX)) {
            return true;
        }
        if (jdbcUrl.startsWith(POSTGRES_PREFIX)) {
            return false;
        }
        throw new IllegalArgumentException("Unsupported JDBC url: " + jdbcUrl);
    }

    SqlDialect dialect() {
        return isSqlite() ? new SQLiteDialect() : new PostgresDialect();
    }

    Plugin plugin(FieldRegistry registry) {
        return isSqlite() ? new SQLitePlugin(registry) : new PostgresPlugin(registry);
    }

    StoreConfig storeConfig() {
        if (isSqlite()) {
            return new SQLiteConfig(jdbcUrl.substring(SQLITE_PREFIX.length()));
        }
        return new PostgresConfig(jdbcUrl, username, password);
    }

    Connection connect() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, username, password);
    }
}
