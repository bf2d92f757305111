package io.chatvault.security;

import io.chatvault.config.EnvironmentOverrides;
import io.chatvault.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the database key and the field key. Each key is resolved at most once per
 * instance and held for the instance lifetime; one instance is created at bootstrap and
 * passed to everything that needs key material.
 *
 * <p>Resolution order: secret store, then the hex environment variable, then (unless
 * {@code existingOnly}) a freshly generated key. A generated key is written back to the
 * secret store when one is present; otherwise it is ephemeral and lost at process exit.
 */
public final class KeyManager {
    public static final String SERVICE = "ChatVault";

    private static final Logger LOG = LoggerFactory.getLogger(KeyManager.class);

    private final SecretStore secretStore;
    private final EnvironmentOverrides environment;
    private final SecureRandom secureRandom;
    private final Map<KeyKind, KeyMaterial> resolved;

    public KeyManager(Optional<? extends SecretStore> secretStore, EnvironmentOverrides environment) {
        this.secretStore = secretStore.isPresent() ? secretStore.get() : null;
        this.environment = environment == null ? EnvironmentOverrides.none() : environment;
        this.secureRandom = new SecureRandom();
        this.resolved = new EnumMap<>(KeyKind.class);
    }

    public boolean hasSecretStore() {
        return secretStore != null;
    }

    public synchronized Optional<KeyMaterial> getOrCreate(KeyKind kind, boolean existingOnly) {
        KeyMaterial cached = resolved.get(kind);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<KeyMaterial> found = fromSecretStore(kind).or(() -> fromEnvironment(kind));
        if (found.isPresent()) {
            resolved.put(kind, found.get());
            return found;
        }
        if (existingOnly) {
            return Optional.empty();
        }
        KeyMaterial created = generate(kind);
        resolved.put(kind, created);
        return Optional.of(created);
    }

    /** Existing key or {@link KeyUnavailableException}. */
    public KeyMaterial require(KeyKind kind) {
        return getOrCreate(kind, true).orElseThrow(() -> new KeyUnavailableException(kind,
                "No " + describe(kind) + " found in the secret store or " + kind.envVar()));
    }

    private Optional<KeyMaterial> fromSecretStore(KeyKind kind) {
        if (secretStore == null) {
            return Optional.empty();
        }
        Optional<String> stored;
        try {
            stored = secretStore.read(kind.account());
        } catch (SecretStoreException e) {
            LOG.warn("Could not read {} from {}: {}", describe(kind), secretStore.describe(), e.getMessage());
            return Optional.empty();
        }
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        Optional<byte[]> raw = decode(stored.get());
        if (raw.isEmpty()) {
            LOG.warn("Stored {} in {} is not a 64-hex key; ignoring stored value", describe(kind), secretStore.describe());
            return Optional.empty();
        }
        return Optional.of(new KeyMaterial(kind, raw.get(), KeyMaterial.Source.SECRET_STORE));
    }

    private Optional<KeyMaterial> fromEnvironment(KeyKind kind) {
        Optional<String> hex = environment.keyHex(kind);
        if (hex.isEmpty()) {
            return Optional.empty();
        }
        Optional<byte[]> raw = decode(hex.get());
        if (raw.isEmpty()) {
            LOG.error("{} is not a valid 64-hex key; ignoring it", kind.envVar());
            return Optional.empty();
        }
        return Optional.of(new KeyMaterial(kind, raw.get(), KeyMaterial.Source.ENVIRONMENT));
    }

    private KeyMaterial generate(KeyKind kind) {
        byte[] raw = new byte[KeyMaterial.KEY_BYTES];
        secureRandom.nextBytes(raw);
        if (secretStore != null) {
            try {
                secretStore.write(kind.account(), Hashing.toHex(raw));
                LOG.info("Generated new {} and stored it in {}", describe(kind), secretStore.describe());
                return new KeyMaterial(kind, raw, KeyMaterial.Source.GENERATED_STORED);
            } catch (SecretStoreException e) {
                LOG.warn("Could not store new {} in {}: {}", describe(kind), secretStore.describe(), e.getMessage());
            }
        }
        LOG.warn("Generated an EPHEMERAL {} that will be lost at exit; set {} to a 64-hex key to persist it",
                describe(kind), kind.envVar());
        return new KeyMaterial(kind, raw, KeyMaterial.Source.EPHEMERAL);
    }

    private static Optional<byte[]> decode(String hex) {
        try {
            byte[] raw = Hashing.fromHex(hex);
            return raw.length == KeyMaterial.KEY_BYTES ? Optional.of(raw) : Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String describe(KeyKind kind) {
        return kind == KeyKind.DATABASE ? "database key" : "field key";
    }
}
