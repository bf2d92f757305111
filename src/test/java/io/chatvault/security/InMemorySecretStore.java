package io.chatvault.security;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Secret store double; can be switched to fail reads or writes. */
public final class InMemorySecretStore implements SecretStore {
    private final Map<String, String> entries = new LinkedHashMap<>();
    private boolean failReads;
    private boolean failWrites;
    private int writes;

    public InMemorySecretStore failReads(boolean fail) {
        this.failReads = fail;
        return this;
    }

    public InMemorySecretStore failWrites(boolean fail) {
        this.failWrites = fail;
        return this;
    }

    public InMemorySecretStore put(String account, String secret) {
        entries.put(account, secret);
        return this;
    }

    public Optional<String> get(String account) {
        return Optional.ofNullable(entries.get(account));
    }

    public int writes() {
        return writes;
    }

    @Override
    public Optional<String> read(String account) throws SecretStoreException {
        if (failReads) {
            throw new SecretStoreException("read refused", null);
        }
        return Optional.ofNullable(entries.get(account));
    }

    @Override
    public void write(String account, String secret) throws SecretStoreException {
        if (failWrites) {
            throw new SecretStoreException("write refused", null);
        }
        writes++;
        entries.put(account, secret);
    }

    @Override
    public String describe() {
        return "in-memory";
    }
}
