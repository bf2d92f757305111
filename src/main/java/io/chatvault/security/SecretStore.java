package io.chatvault.security;

import java.util.Optional;

/**
 * OS-level secret storage, addressed by account name under one fixed service.
 * Implementations report backend failures as {@link SecretStoreException} so callers
 * have to decide how to degrade.
 */
public interface SecretStore {

    Optional<String> read(String account) throws SecretStoreException;

    void write(String account, String secret) throws SecretStoreException;

    String describe();
}
