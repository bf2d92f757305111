package io.chatvault.security;

import io.chatvault.util.Hashing;

import javax.crypto.spec.SecretKeySpec;
import java.util.Arrays;

/**
 * A resolved 32-byte key and where it came from. Never printed: {@link #toString()} is
 * redacted.
 */
public final class KeyMaterial {
    public static final int KEY_BYTES = 32;

    private final KeyKind kind;
    private final byte[] raw;
    private final Source source;

    public KeyMaterial(KeyKind kind, byte[] raw, Source source) {
        if (raw == null || raw.length != KEY_BYTES) {
            throw new IllegalArgumentException(kind + " key must be " + KEY_BYTES + " bytes");
        }
        this.kind = kind;
        this.raw = Arrays.copyOf(raw, raw.length);
        this.source = source;
    }

    public KeyKind kind() {
        return kind;
    }

    public Source source() {
        return source;
    }

    /** True when the key survives process exit. */
    public boolean durable() {
        return source != Source.EPHEMERAL;
    }

    public byte[] bytes() {
        return Arrays.copyOf(raw, raw.length);
    }

    String hex() {
        return Hashing.toHex(raw);
    }

    public SecretKeySpec aesKey() {
        return new SecretKeySpec(raw, "AES");
    }

    /**
     * SQLCipher raw-key literal, e.g. {@code "x'00ff..'"}. Only ever handed to the engine.
     */
    public String sqlCipherLiteral() {
        return "\"x'" + hex() + "'\"";
    }

    @Override
    public String toString() {
        return "KeyMaterial[" + kind + ", source=" + source + ", ***]";
    }

    public enum Source {
        SECRET_STORE,
        ENVIRONMENT,
        GENERATED_STORED,
        EPHEMERAL
    }
}
