package com.mergeql.core.reconcile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mergeql.core.FieldCategory;
import com.mergeql.core.MergeException;
import com.tailoredshapes.stash.Stash;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Conversions between the raw values a JDBC driver hands back and the
 * normalised Java types the reconciliation algebra works on.
 * <ul>
 *     <li>text, selection, polymorphic reference: {@link String}</li>
 *     <li>integer, single reference: {@link Long}</li>
 *     <li>float: {@link Double}</li>
 *     <li>boolean: {@link Boolean}</li>
 *     <li>date: {@link LocalDate}, datetime: {@link LocalDateTime}</li>
 *     <li>binary: {@code byte[]}</li>
 *     <li>structured: {@link Stash}</li>
 *     <li>multi and reverse references: {@code List<Long>}</li>
 * </ul>
 */
public final class FieldValues {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private FieldValues() {}

    public static Object normalize(FieldCategory category, Object raw) {
        if (raw == null) {
            return null;
        }
        switch (category) {
            case SHORT_TEXT:
            case LONG_TEXT:
            case SELECTION:
            case POLYMORPHIC_REFERENCE:
                return raw.toString();
            case INTEGER:
            case SINGLE_REFERENCE:
                return toLong(raw);
            case FLOAT:
                return toDouble(raw);
            case BOOLEAN:
                return toBoolean(raw);
            case DATE:
                return toDate(raw);
            case DATETIME:
                return toDateTime(raw);
            case BINARY:
                return raw instanceof byte[] ? raw : raw.toString().getBytes(StandardCharsets.UTF_8);
            case STRUCTURED:
                return toStructured(raw);
            case MULTI_REFERENCE:
            case REVERSE_MULTI_REFERENCE:
                return toIdList(raw);
            default:
                throw new IllegalStateException("Unhandled category " + category);
        }
    }

    /**
     * The value as it is bound to a statement: structured values become JSON text.
     */
    public static Object toStorage(FieldCategory category, Object value) {
        if (value == null) {
            return null;
        }
        if (category == FieldCategory.STRUCTURED && value instanceof Stash) {
            return ((Stash) value).toJSONString();
        }
        if (category == FieldCategory.STRUCTURED && !(value instanceof String)) {
            try {
                return OBJECT_MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new MergeException("Failed to serialise structured value", e);
            }
        }
        return value;
    }

    /**
     * Null, blank text, empty collections, maps, stashes and byte arrays count as empty.
     */
    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).isBlank();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Stash) {
            return ((Stash) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value instanceof byte[]) {
            return ((byte[]) value).length == 0;
        }
        return false;
    }

    /**
     * Equality used to decide whether a field actually changed.
     * Id lists compare as sets; numbers compare by value; structured values compare key by key.
     */
    public static boolean sameValue(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number && b instanceof Number) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
        }
        if (a instanceof Collection && b instanceof Collection) {
            return new HashSet<>((Collection<?>) a).equals(new HashSet<>((Collection<?>) b));
        }
        if (a instanceof byte[] && b instanceof byte[]) {
            return Arrays.equals((byte[]) a, (byte[]) b);
        }
        if (a instanceof Stash && b instanceof Stash) {
            Stash left = (Stash) a;
            Stash right = (Stash) b;
            if (!left.keySet().equals(right.keySet())) {
                return false;
            }
            return left.keySet().stream().allMatch(key -> sameValue(left.get(key), right.get(key)));
        }
        return Objects.equals(a, b);
    }

    static Long toLong(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).longValue();
        }
        String text = raw.toString().trim();
        return text.isEmpty() ? null : Long.parseLong(text);
    }

    static Double toDouble(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        String text = raw.toString().trim();
        return text.isEmpty() ? null : Double.parseDouble(text);
    }

    static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof Number) {
            return ((Number) raw).intValue() != 0;
        }
        String text = raw.toString().trim().toLowerCase(Locale.ROOT);
        return text.equals("true") || text.equals("t") || text.equals("1") || text.equals("yes");
    }

    static LocalDate toDate(Object raw) {
        if (raw instanceof LocalDate) {
            return (LocalDate) raw;
        }
        if (raw instanceof java.sql.Date) {
            return ((java.sql.Date) raw).toLocalDate();
        }
        if (raw instanceof Timestamp) {
            return ((Timestamp) raw).toLocalDateTime().toLocalDate();
        }
        if (raw instanceof LocalDateTime) {
            return ((LocalDateTime) raw).toLocalDate();
        }
        String text = raw.toString().trim();
        return text.isEmpty() ? null : LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
    }

    static LocalDateTime toDateTime(Object raw) {
        if (raw instanceof LocalDateTime) {
            return (LocalDateTime) raw;
        }
        if (raw instanceof Timestamp) {
            return ((Timestamp) raw).toLocalDateTime();
        }
        if (raw instanceof LocalDate) {
            return ((LocalDate) raw).atStartOfDay();
        }
        if (raw instanceof Number) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Number) raw).longValue()), ZoneOffset.UTC);
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.length() == 10) {
            return LocalDate.parse(text).atStartOfDay();
        }
        return LocalDateTime.parse(text.replace(' ', 'T'));
    }

    @SuppressWarnings("unchecked")
    static Stash toStructured(Object raw) {
        if (raw instanceof Stash) {
            return (Stash) raw;
        }
        if (raw instanceof Map) {
            Stash stash = new Stash();
            ((Map<String, Object>) raw).forEach((key, value) -> {
                if (value != null) {
                    stash.put(key, value instanceof Map ? toStructured(value) : value);
                }
            });
            return stash;
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (!text.startsWith("{")) {
            throw new MergeException("Structured value is not a JSON object: " + text);
        }
        try {
            return Stash.parseJSON(text);
        } catch (RuntimeException e) {
            throw new MergeException("Structured value is not a JSON object: " + text, e);
        }
    }

    static List<Long> toIdList(Object raw) {
        List<Long> ids = new ArrayList<>();
        if (raw instanceof Collection) {
            for (Object o : (Collection<?>) raw) {
                if (o != null) {
                    ids.add(toLong(o));
                }
            }
        } else {
            ids.add(toLong(raw));
        }
        return ids;
    }
}
