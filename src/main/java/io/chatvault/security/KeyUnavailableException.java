package io.chatvault.security;

import io.chatvault.ChatVaultException;

public final class KeyUnavailableException extends ChatVaultException {
    private final KeyKind kind;

    public KeyUnavailableException(KeyKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public KeyUnavailableException(KeyKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public KeyKind kind() {
        return kind;
    }
}
