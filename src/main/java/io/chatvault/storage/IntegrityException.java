package io.chatvault.storage;

import io.chatvault.ChatVaultException;

public final class IntegrityException extends ChatVaultException {
    private final Reason reason;

    public IntegrityException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public IntegrityException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        CHECK_FAILED,
        ENGINE_MISMATCH,
        META_MISSING
    }
}
