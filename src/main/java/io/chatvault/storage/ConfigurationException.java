package io.chatvault.storage;

import io.chatvault.ChatVaultException;

public final class ConfigurationException extends ChatVaultException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
