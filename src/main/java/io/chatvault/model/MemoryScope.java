package io.chatvault.model;

import java.util.Locale;

public enum MemoryScope {
    USER("user"),
    CONVERSATION("conversation"),
    GLOBAL("global");

    private final String dbValue;

    MemoryScope(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static MemoryScope fromDb(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (MemoryScope scope : values()) {
            if (scope.dbValue.equals(normalized)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown memory scope: " + raw);
    }
}
