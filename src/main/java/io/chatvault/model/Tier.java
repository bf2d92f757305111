package io.chatvault.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Confidentiality tier of a database file. The tier is fixed when the file is created
 * and recorded in {@code meta.db_mode}.
 */
public enum Tier {
    OPEN("open", false, false),
    SECURE("secure", true, false),
    STRICT("strict", true, true);

    private final String dbValue;
    private final boolean fileEncrypted;
    private final boolean fieldsSealed;

    Tier(String dbValue, boolean fileEncrypted, boolean fieldsSealed) {
        this.dbValue = dbValue;
        this.fileEncrypted = fileEncrypted;
        this.fieldsSealed = fieldsSealed;
    }

    public String dbValue() {
        return dbValue;
    }

    /** Whole-file encryption through the cipher engine. */
    public boolean fileEncrypted() {
        return fileEncrypted;
    }

    /** Per-field AEAD sealing of message and memory content. */
    public boolean fieldsSealed() {
        return fieldsSealed;
    }

    public static Optional<Tier> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Tier tier : values()) {
            if (tier.dbValue.equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return dbValue;
    }
}
