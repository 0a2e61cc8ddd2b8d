package com.mergeql.cli.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mergeql.core.FieldRegistry;
import com.mergeql.core.config.MergeSettings;
import com.mergeql.repositories.rdbms.CatalogIntrospector;
import com.mergeql.repositories.rdbms.JdbcFieldRegistry;
import com.mergeql.repositories.rdbms.RelationGraph;
import com.mergeql.repositories.rdbms.SqlDialect;
import com.mergeql.repositories.rdbms.SqlSession;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.sql.Connection;

@Command(
        name = "introspect",
        description = "Show every foreign key, reference field and typed reference column pointing at an entity type",
        mixinStandardHelpOptions = true
)
public class IntrospectCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Mixin
    private StoreOptions store;

    @Option(names = {"--type", "-t"}, required = true, description = "Entity type name")
    private String entityType;

    @Option(names = {"--table"}, description = "Backing table, when the catalog does not know the type")
    private String table;

    @Option(names = {"--output", "-o"}, description = "Output file (default: stdout)")
    private File output;

    @Override
    public void run() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        SqlDialect dialect = store.dialect();
        try (Connection connection = store.connect()) {
            MergeSettings settings = store.settings(mapper);
            SqlSession session = new SqlSession(connection, dialect);
            FieldRegistry registry = store.registry(mapper);
            if (registry == null) {
                registry = new JdbcFieldRegistry(session, settings.metadata());
            }
            CatalogIntrospector introspector = new CatalogIntrospector(session, registry, settings);
            RelationGraph graph = introspector.discover(introspector.resolve(entityType, table));

            if (output != null) {
                mapper.writeValue(output, graph);
                spec.commandLine().getOut().println("Introspection written to " + output.getAbsolutePath());
            } else {
                spec.commandLine().getOut().println(mapper.writeValueAsString(graph));
            }
        } catch (Exception e) {
            throw new IllegalStateException("Introspection of " + entityType + " failed: " + e.getMessage(), e);
        }
    }
}
