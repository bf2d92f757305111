package io.chatvault.security;

import io.chatvault.model.Content;
import io.chatvault.model.ReadableText;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * AES-256-GCM sealing of individual text fields for the strict tier. Every call draws a
 * fresh 96-bit nonce. The optional context string (storage passes {@code table:rowid}) is
 * bound as associated data, so a ciphertext sealed for one row does not open under another.
 */
public final class FieldCodec {
    public static final int KEY_ID = 1;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_NONCE_BYTES = 12;

    private final SecretKeySpec key;
    private final SecureRandom secureRandom;

    public FieldCodec(KeyMaterial fieldKey) {
        if (fieldKey.kind() != KeyKind.FIELD) {
            throw new IllegalArgumentException("FieldCodec requires the field key, got " + fieldKey.kind());
        }
        this.key = fieldKey.aesKey();
        this.secureRandom = new SecureRandom();
    }

    public Content.Sealed seal(String plaintext) {
        return seal(plaintext, null);
    }

    public Content.Sealed seal(String plaintext, String context) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        byte[] nonce = new byte[GCM_NONCE_BYTES];
        secureRandom.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, nonce));
            bindContext(cipher, context);
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return new Content.Sealed(ciphertext, nonce, KEY_ID);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to seal field", e);
        }
    }

    public String open(Content.Sealed sealed) {
        return open(sealed, null);
    }

    public String open(Content.Sealed sealed, String context) {
        if (sealed.nonce().length != GCM_NONCE_BYTES) {
            throw new DecryptionException("Invalid nonce length: " + sealed.nonce().length);
        }
        if (sealed.keyId() != KEY_ID) {
            throw new DecryptionException("Unknown field key id: " + sealed.keyId());
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, sealed.nonce()));
            bindContext(cipher, context);
            byte[] plain = cipher.doFinal(sealed.ciphertext());
            return new String(plain, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Field authentication failed (wrong key or tampered data)", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to open sealed field", e);
        }
    }

    /**
     * Maps stored content to readable text, capturing a decryption failure instead of
     * hiding it.
     */
    public ReadableText read(Content content, String context) {
        if (content instanceof Content.Plain plain) {
            return ReadableText.of(plain.text());
        }
        try {
            return ReadableText.of(open((Content.Sealed) content, context));
        } catch (DecryptionException e) {
            return ReadableText.failed(e);
        }
    }

    private static void bindContext(Cipher cipher, String context) {
        if (context != null && !context.isEmpty()) {
            cipher.updateAAD(context.getBytes(StandardCharsets.UTF_8));
        }
    }
}
