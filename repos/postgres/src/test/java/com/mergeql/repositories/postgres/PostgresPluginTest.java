package com.mergeql.repositories.postgres;

import com.mergeql.core.config.MergeSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PostgresPluginTest {
    private final PostgresPlugin plugin = new PostgresPlugin();

    @AfterEach
    public void cleanUp() {
        plugin.cleanUp();
    }

    @Test
    public void configWithoutUrlIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> plugin.createEngine(new PostgresConfig(), MergeSettings.defaults()));
    }

    @Test
    public void defaultsMatchASmallPool() {
        PostgresConfig config = new PostgresConfig("jdbc:postgresql://localhost/crm", "alice", "face");

        assertEquals("postgres", config.type);
        assertEquals(4, config.maxPoolSize);
        assertEquals(1, config.minIdle);
    }
}
