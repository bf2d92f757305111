package io.chatvault.model;

import java.util.Locale;

public enum SenderType {
    USER("user"),
    ASSISTANT("assistant"),
    SYSTEM("system"),
    TOOL("tool");

    private final String dbValue;

    SenderType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static SenderType fromDb(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (SenderType type : values()) {
            if (type.dbValue.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown sender type: " + raw);
    }
}
