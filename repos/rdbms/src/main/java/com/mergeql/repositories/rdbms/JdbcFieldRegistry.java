package com.mergeql.repositories.rdbms;

import com.mergeql.core.EntityType;
import com.mergeql.core.FieldCategory;
import com.mergeql.core.FieldMetadata;
import com.mergeql.core.FieldRegistry;
import com.mergeql.core.MergeStoreException;
import com.mergeql.core.config.MetadataTables;
import com.mergeql.core.reconcile.FieldValues;
import com.tailoredshapes.stash.Stash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field registry read from the store's metadata catalog tables
 * ({@code model_registry} and {@code model_field} by default). Loaded once.
 */
public class JdbcFieldRegistry implements FieldRegistry {
    private static final Logger logger = LoggerFactory.getLogger(JdbcFieldRegistry.class);

    private final SqlSession session;
    private final MetadataTables tables;
    private Map<String, EntityType> entityTypes;
    private List<FieldMetadata> fields;

    public JdbcFieldRegistry(SqlSession session, MetadataTables tables) {
        this.session = session;
        this.tables = tables;
    }

    @Override
    public Optional<EntityType> entityType(String name) {
        load();
        return Optional.ofNullable(entityTypes.get(name));
    }

    @Override
    public List<FieldMetadata> allFields() {
        load();
        return fields;
    }

    private synchronized void load() {
        if (fields != null) {
            return;
        }
        try {
            Map<String, EntityType> types = new LinkedHashMap<>();
            if (session.dialect().tableExists(session.connection(), tables.modelTable())) {
                for (Stash row : session.query("SELECT * FROM " + session.quote(tables.modelTable()),
                        List.of())) {
                    String name = (String) row.get("name");
                    types.put(name, new EntityType(name, (String) row.get("table_name")));
                }
            }
            List<FieldMetadata> loaded = new ArrayList<>();
            if (session.dialect().tableExists(session.connection(), tables.fieldTable())) {
                for (Stash row : session.query("SELECT * FROM " + session.quote(tables.fieldTable()),
                        List.of())) {
                    toField(row).ifPresent(loaded::add);
                }
            }
            this.entityTypes = Map.copyOf(types);
            this.fields = List.copyOf(loaded);
            logger.info("Loaded metadata catalog: {} entity types, {} fields", types.size(), loaded.size());
        } catch (SQLException e) {
            throw new MergeStoreException("Failed to load the metadata catalog", e);
        }
    }

    private Optional<FieldMetadata> toField(Stash row) {
        String model = (String) row.get("model");
        String name = (String) row.get("name");
        FieldCategory category;
        try {
            category = FieldCategory.fromTypeName((String) row.get("ttype"));
        } catch (IllegalArgumentException e) {
            logger.debug("Ignoring field {}.{}: {}", model, name, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(new FieldMetadata(
                model,
                name,
                category,
                (String) row.get("relation"),
                flag(row.get("stored"), true),
                flag(row.get("computed"), false),
                (String) row.get("relation_table"),
                (String) row.get("column1"),
                (String) row.get("column2"),
                (String) row.get("inverse_name")));
    }

    private static boolean flag(Object value, boolean whenMissing) {
        Object normalized = FieldValues.normalize(FieldCategory.BOOLEAN, value);
        return normalized == null ? whenMissing : (Boolean) normalized;
    }
}
