package io.chatvault.model;

import java.util.Locale;

public enum Role {
    USER("user"),
    ADMIN("admin");

    private final String dbValue;

    Role(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static Role fromDb(String raw) {
        if (raw == null) {
            return USER;
        }
        return "admin".equals(raw.trim().toLowerCase(Locale.ROOT)) ? ADMIN : USER;
    }
}
