package com.dailyBrief.accountBrief.record.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One provider record as an untyped key/value lookup.
 *
 * Every accessor is total: absent keys and values of the wrong type yield a default
 * (empty string, empty record, empty list, false) instead of an exception.
 */
@ToString
@EqualsAndHashCode
public final class RawRecord {

    private static final RawRecord EMPTY = new RawRecord(Map.of());

    private final Map<String, Object> fields;

    private RawRecord(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static RawRecord of(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        return new RawRecord(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static RawRecord empty() {
        return EMPTY;
    }

    public boolean has(String key) {
        return fields.get(key) != null;
    }

    public Object get(String key) {
        return fields.get(key);
    }

    /**
     * @return The string value, or "" when absent or not a string
     */
    public String string(String key) {
        return fields.get(key) instanceof String s ? s : "";
    }

    /**
     * @return The nested object, or an empty record when absent or not an object
     */
    @SuppressWarnings("unchecked")
    public RawRecord object(String key) {
        if (fields.get(key) instanceof Map<?, ?> map) {
            return of((Map<String, ?>) map);
        }
        return EMPTY;
    }

    /**
     * @return The elements of the list value, or an empty list when absent or not a list
     */
    public List<Object> list(String key) {
        if (fields.get(key) instanceof List<?> list) {
            return Collections.<Object>unmodifiableList(list);
        }
        return List.of();
    }

    /**
     * @return The object elements of the list value; non-object elements are skipped
     */
    @SuppressWarnings("unchecked")
    public List<RawRecord> objects(String key) {
        List<RawRecord> result = new ArrayList<>();
        for (Object item : list(key)) {
            if (item instanceof Map<?, ?> map) {
                result.add(of((Map<String, ?>) map));
            }
        }
        return result;
    }

    /**
     * @return The string elements of the list value; other elements are skipped
     */
    public List<String> stringList(String key) {
        List<String> result = new ArrayList<>();
        for (Object item : list(key)) {
            if (item instanceof String s) {
                result.add(s);
            }
        }
        return result;
    }

    /**
     * @return True only for a boolean true value
     */
    public boolean bool(String key) {
        return Boolean.TRUE.equals(fields.get(key));
    }

    public Map<String, Object> asMap() {
        return fields;
    }
}
