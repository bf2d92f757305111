package io.chatvault.security;

import io.chatvault.ChatVaultException;

public final class DecryptionException extends ChatVaultException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
