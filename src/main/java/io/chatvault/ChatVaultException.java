package io.chatvault;

/**
 * Root of the fatal and cryptographic failure categories. Configuration, key and
 * integrity failures abort bootstrap; decryption failures abort only the read that hit
 * them. Recoverable domain refusals are reported through outcome records instead.
 */
public abstract class ChatVaultException extends RuntimeException {

    protected ChatVaultException(String message) {
        super(message);
    }

    protected ChatVaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
