package com.mergeql.repositories.postgres;

import com.mergeql.core.config.StoreConfig;

public class PostgresConfig extends StoreConfig {
    public String uri;
    public String username;
    public String password;
    public int maxPoolSize = 4;
    public int minIdle = 1;

    public PostgresConfig() {
        super("postgres");
    }

    public PostgresConfig(String uri, String username, String password) {
        this();
        this.uri = uri;
        this.username = username;
        this.password = password;
    }
}
