package io.chatvault.security;

import com.github.javakeyring.BackendNotSupportedException;
import com.github.javakeyring.Keyring;
import com.github.javakeyring.PasswordAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * {@link SecretStore} backed by the platform keychain (macOS Keychain, Windows Credential
 * Manager, freedesktop Secret Service or KWallet).
 */
public final class KeyringSecretStore implements SecretStore, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(KeyringSecretStore.class);

    private final Keyring keyring;
    private final String service;

    private KeyringSecretStore(Keyring keyring, String service) {
        this.keyring = keyring;
        this.service = service;
    }

    /**
     * Opens the platform keychain, or returns empty when this platform has no supported
     * backend. An empty result is the degraded path: keys fall back to the environment.
     */
    public static Optional<KeyringSecretStore> open(String service) {
        try {
            Keyring keyring = Keyring.create();
            LOG.debug("Secret store backend: {}", keyring.getKeyringStorageType());
            return Optional.of(new KeyringSecretStore(keyring, service));
        } catch (BackendNotSupportedException e) {
            LOG.info("No OS secret store available ({}); keys must come from the environment", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> read(String account) throws SecretStoreException {
        try {
            String value = keyring.getPassword(service, account);
            return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
        } catch (PasswordAccessException e) {
            // Backends also report a missing entry through this exception.
            throw new SecretStoreException("Secret store entry unreadable: " + service + "/" + account, e);
        }
    }

    @Override
    public void write(String account, String secret) throws SecretStoreException {
        try {
            keyring.setPassword(service, account, secret);
        } catch (PasswordAccessException e) {
            throw new SecretStoreException("Secret store write failed: " + service + "/" + account, e);
        }
    }

    @Override
    public String describe() {
        return "keyring:" + keyring.getKeyringStorageType();
    }

    @Override
    public void close() {
        try {
            keyring.close();
        } catch (Exception e) {
            LOG.warn("Failed to close secret store backend", e);
        }
    }
}
