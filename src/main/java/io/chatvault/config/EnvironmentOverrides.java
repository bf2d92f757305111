package io.chatvault.config;

import io.chatvault.model.Tier;
import io.chatvault.security.KeyKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Process-level overrides, captured once at bootstrap.
 */
public final class EnvironmentOverrides {
    public static final String DB_MODE = "CHATVAULT_DB_MODE";
    public static final String DATA_DIR = "CHATVAULT_DATA_DIR";

    private static final Logger LOG = LoggerFactory.getLogger(EnvironmentOverrides.class);

    private final Map<String, String> values;

    private EnvironmentOverrides(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static EnvironmentOverrides system() {
        return from(System.getenv());
    }

    public static EnvironmentOverrides from(Map<String, String> env) {
        return new EnvironmentOverrides(env == null ? Map.of() : env);
    }

    public static EnvironmentOverrides none() {
        return new EnvironmentOverrides(Map.of());
    }

    /**
     * Tier forced through {@value #DB_MODE}; an unrecognised value is logged and ignored.
     */
    public Optional<Tier> tier() {
        String raw = value(DB_MODE);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Optional<Tier> parsed = Tier.parse(raw);
        if (parsed.isEmpty()) {
            LOG.warn("Ignoring {}={}: expected open, secure or strict", DB_MODE, raw);
        }
        return parsed;
    }

    /** Hex-encoded key, or empty. The value is never logged. */
    public Optional<String> keyHex(KeyKind kind) {
        String raw = value(kind.envVar());
        return raw.isEmpty() ? Optional.empty() : Optional.of(raw);
    }

    public Optional<String> dataDir() {
        String raw = value(DATA_DIR);
        return raw.isEmpty() ? Optional.empty() : Optional.of(raw);
    }

    private String value(String name) {
        String raw = values.get(name);
        return raw == null ? "" : raw.trim();
    }
}
