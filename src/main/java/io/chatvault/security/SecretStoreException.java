package io.chatvault.security;

public final class SecretStoreException extends Exception {

    public SecretStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
