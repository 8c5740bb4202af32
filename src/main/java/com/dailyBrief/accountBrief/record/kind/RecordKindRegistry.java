package com.dailyBrief.accountBrief.record.kind;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Looks up record kinds by name.
 */
@Component
public class RecordKindRegistry {

    private final Map<String, RecordKind> kinds;

    public RecordKindRegistry(List<RecordKind> kinds) {
        Map<String, RecordKind> byName = new LinkedHashMap<>();
        for (RecordKind kind : kinds) {
            if (byName.put(kind.name(), kind) != null) {
                throw new IllegalStateException("Duplicate record kind: " + kind.name());
            }
        }
        this.kinds = Collections.unmodifiableMap(byName);
    }

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public RecordKind get(String name) {
        RecordKind kind = name == null ? null : kinds.get(name.trim().toLowerCase(Locale.ROOT));
        if (kind == null) {
            throw new IllegalArgumentException("Unknown record kind: " + name + ". Use one of " + kinds.keySet());
        }
        return kind;
    }
}
