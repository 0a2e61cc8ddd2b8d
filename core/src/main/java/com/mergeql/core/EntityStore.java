package com.mergeql.core;

import com.tailoredshapes.stash.Stash;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed entity facade used by the ORM merge mode.
 * Field names are resolved against the {@link FieldRegistry}; values use the
 * normalised Java types of {@link com.mergeql.core.reconcile.FieldValues}.
 */
public interface EntityStore {

    /**
     * Ids of {@code entityType} rows whose {@code field} holds one of {@code values}.
     * For multi references a row matches when any of its links does.
     */
    List<Long> search(String entityType, String field, Collection<?> values);

    /**
     * The subset of {@code ids} that still exist, in the given order.
     */
    List<Long> exists(String entityType, Collection<Long> ids);

    /**
     * Current values of {@code fields} for each id. Multi and reverse references
     * are returned as lists of ids; null values are left out.
     */
    Map<Long, Stash> read(String entityType, Collection<Long> ids, Collection<FieldMetadata> fields);

    /**
     * Writes column backed values to all {@code ids} in one statement.
     *
     * @return rows changed
     */
    int write(String entityType, Collection<Long> ids, Map<String, Object> values);

    /**
     * Links every id to every target through a multi reference field, skipping
     * links that already exist.
     */
    int addLinks(String entityType, String field, Collection<Long> ids, Collection<Long> targets);

    int removeLinks(String entityType, String field, Collection<Long> ids, Collection<Long> targets);

    /**
     * Deletes the rows together with their registry entries and own links.
     */
    int unlink(String entityType, Collection<Long> ids);
}
