package io.chatvault.model;

import io.chatvault.security.DecryptionException;

/**
 * Result of reading a possibly sealed field: either the text or the decryption failure.
 * Only the presentation layer may collapse a failure into a placeholder.
 */
public record ReadableText(String text, DecryptionException failure) {

    public static ReadableText of(String text) {
        return new ReadableText(text == null ? "" : text, null);
    }

    public static ReadableText failed(DecryptionException failure) {
        return new ReadableText(null, failure);
    }

    public boolean readable() {
        return failure == null;
    }

    public String orThrow() {
        if (failure != null) {
            throw failure;
        }
        return text;
    }

    public String orElse(String placeholder) {
        return failure == null ? text : placeholder;
    }
}
