package com.mergeql.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mergeql.core.ColumnRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Store wide conventions the merge engine relies on. Every component is
 * optional in JSON and falls back to {@link #defaults()}.
 */
public record MergeSettings(
        @JsonProperty("idColumn") String idColumn,
        @JsonProperty("separator") String separator,
        @JsonProperty("externalIds") RegistryTable externalIds,
        @JsonProperty("attachments") RegistryTable attachments,
        @JsonProperty("translations") TranslationTable translations,
        @JsonProperty("subsystems") List<PolymorphicSubsystem> subsystems,
        @JsonProperty("extraReferenceColumns") List<ColumnRef> extraReferenceColumns,
        @JsonProperty("metadata") MetadataTables metadata,
        @JsonProperty("onRecursion") RecursionPolicy onRecursion
) {
    public static final String DEFAULT_SEPARATOR = " | ";

    public static final List<PolymorphicSubsystem> DEFAULT_SUBSYSTEMS = List.of(
            PolymorphicSubsystem.of("calendar_event", "res_model"),
            PolymorphicSubsystem.of("attachment", "res_model"),
            PolymorphicSubsystem.of("activity", "res_model"),
            PolymorphicSubsystem.correlated("follower", "res_model", "partner_id"),
            PolymorphicSubsystem.of("message", "model"),
            PolymorphicSubsystem.of("rating", "res_model"));

    public MergeSettings {
        idColumn = idColumn != null ? idColumn : "id";
        separator = separator != null ? separator : DEFAULT_SEPARATOR;
        externalIds = externalIds != null ? externalIds : new RegistryTable("external_id", "model", "res_id");
        attachments = attachments != null ? attachments : new RegistryTable("attachment", "res_model", "res_id");
        translations = translations != null ? translations : new TranslationTable(null, null, null, null, null, null);
        subsystems = subsystems != null ? List.copyOf(subsystems) : DEFAULT_SUBSYSTEMS;
        extraReferenceColumns = extraReferenceColumns != null ? List.copyOf(extraReferenceColumns) : List.of();
        metadata = metadata != null ? metadata : new MetadataTables(null, null);
        onRecursion = onRecursion != null ? onRecursion : RecursionPolicy.LOG;
    }

    public static MergeSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String idColumn;
        private String separator;
        private RegistryTable externalIds;
        private RegistryTable attachments;
        private TranslationTable translations;
        private List<PolymorphicSubsystem> subsystems;
        private final List<ColumnRef> extraReferenceColumns = new ArrayList<>();
        private MetadataTables metadata;
        private RecursionPolicy onRecursion;

        public Builder idColumn(String idColumn) {
            this.idColumn = idColumn;
            return this;
        }

        public Builder separator(String separator) {
            this.separator = separator;
            return this;
        }

        public Builder externalIds(RegistryTable externalIds) {
            this.externalIds = externalIds;
            return this;
        }

        public Builder attachments(RegistryTable attachments) {
            this.attachments = attachments;
            return this;
        }

        public Builder translations(TranslationTable translations) {
            this.translations = translations;
            return this;
        }

        public Builder subsystems(List<PolymorphicSubsystem> subsystems) {
            this.subsystems = new ArrayList<>(subsystems);
            return this;
        }

        public Builder subsystem(PolymorphicSubsystem subsystem) {
            if (this.subsystems == null) {
                this.subsystems = new ArrayList<>(DEFAULT_SUBSYSTEMS);
            }
            this.subsystems.add(subsystem);
            return this;
        }

        public Builder extraReferenceColumn(ColumnRef column) {
            this.extraReferenceColumns.add(column);
            return this;
        }

        public Builder metadata(MetadataTables metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder onRecursion(RecursionPolicy onRecursion) {
            this.onRecursion = onRecursion;
            return this;
        }

        public MergeSettings build() {
            return new MergeSettings(idColumn, separator, externalIds, attachments, translations,
                    subsystems, extraReferenceColumns, metadata, onRecursion);
        }
    }
}
