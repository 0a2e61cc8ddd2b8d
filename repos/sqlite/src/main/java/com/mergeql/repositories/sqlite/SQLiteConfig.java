package com.mergeql.repositories.sqlite;

import com.mergeql.core.config.StoreConfig;

public class SQLiteConfig extends StoreConfig {
    public String file;

    public SQLiteConfig(String file) {
        super("sqlite");
        this.file = file;
    }
}
