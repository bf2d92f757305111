package io.chatvault.security;

import org.bouncycastle.crypto.generators.SCrypt;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;

/**
 * scrypt password hashing with a random per-user salt. Parameters are stored next to
 * each hash so they can be raised later without invalidating existing rows.
 */
public final class PasswordHasher {
    public static final Params DEFAULT_PARAMS = new Params(16_384, 8, 1, 32);
    private static final int SALT_BYTES = 16;

    private final Params params;
    private final SecureRandom secureRandom;
    private final PasswordHash timingDecoy;

    public PasswordHasher() {
        this(DEFAULT_PARAMS);
    }

    public PasswordHasher(Params params) {
        this.params = params;
        this.secureRandom = new SecureRandom();
        this.timingDecoy = hash("timing-decoy");
    }

    public PasswordHash hash(String password) {
        byte[] salt = new byte[SALT_BYTES];
        secureRandom.nextBytes(salt);
        return new PasswordHash(salt, derive(password, salt, params), params);
    }

    public boolean verify(String password, PasswordHash stored) {
        if (password == null) {
            return false;
        }
        byte[] trial = derive(password, stored.salt(), stored.params());
        return MessageDigest.isEqual(trial, stored.hash());
    }

    /**
     * Burns one hash computation so an unknown username costs the same as a wrong password.
     */
    public void verifyDecoy(String password) {
        verify(password == null ? "" : password, timingDecoy);
    }

    private static byte[] derive(String password, byte[] salt, Params params) {
        return SCrypt.generate(password.getBytes(StandardCharsets.UTF_8), salt,
                params.n(), params.r(), params.p(), params.keyLength());
    }

    public record Params(int n, int r, int p, int keyLength) {
        public Params {
            if (n < 2 || (n & (n - 1)) != 0) {
                throw new IllegalArgumentException("scrypt N must be a power of two > 1");
            }
            if (r < 1 || p < 1 || keyLength < 32) {
                throw new IllegalArgumentException("scrypt r/p must be positive and output >= 32 bytes");
            }
        }

        public String encode() {
            return "scrypt:" + n + ":" + r + ":" + p + ":" + keyLength;
        }

        public static Params decode(String encoded) {
            if (encoded == null || encoded.isBlank()) {
                return DEFAULT_PARAMS;
            }
            String[] parts = encoded.trim().split(":");
            if (parts.length != 5 || !"scrypt".equals(parts[0])) {
                throw new IllegalArgumentException("Unsupported password parameters: " + encoded);
            }
            return new Params(
                    Integer.parseInt(parts[1]),
                    Integer.parseInt(parts[2]),
                    Integer.parseInt(parts[3]),
                    Integer.parseInt(parts[4])
            );
        }
    }

    public record PasswordHash(byte[] salt, byte[] hash, Params params) {
    }
}
