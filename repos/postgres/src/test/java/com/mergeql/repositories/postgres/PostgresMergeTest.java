package com.mergeql.repositories.postgres;

import com.mergeql.repositories.certification.MergeCertification;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.DriverManager;
import java.sql.SQLException;

@Testcontainers
@EnabledIfEnvironmentVariable(named = "TESTCONTAINERS", matches = "1")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class PostgresMergeTest extends MergeCertification {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("merge")
            .withUsername("alice")
            .withPassword("face");

    @Override
    public void init() throws SQLException {
        connection = DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(),
                postgres.getPassword());
        dialect = new PostgresDialect();
    }
}
