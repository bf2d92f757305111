package io.chatvault.storage;

import io.chatvault.security.KeyMaterial;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Cipher parameters of the encrypted tiers, issued to the SQLite3 Multiple Ciphers engine
 * in its SQLCipher-compatible scheme. They are part of the file format: changing any of
 * them makes existing files unreadable.
 */
public final class CipherParameters {
    public static final String CIPHER = "sqlcipher";
    public static final int LEGACY_VERSION = 4;
    public static final int PAGE_SIZE = 4096;
    public static final int KDF_ITERATIONS = 256_000;
    /** 0 = SHA1, 1 = SHA256, 2 = SHA512. */
    public static final int HMAC_ALGORITHM = 2;
    public static final int KDF_ALGORITHM = 2;

    private CipherParameters() {
    }

    /**
     * Configures the cipher and keys the connection. The engine only honours cipher
     * settings issued before the key, and the key must precede any read of the file.
     */
    static void apply(Connection conn, KeyMaterial dbKey) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA cipher = '" + CIPHER + "'");
            st.execute("PRAGMA legacy = " + LEGACY_VERSION);
            st.execute("PRAGMA legacy_page_size = " + PAGE_SIZE);
            st.execute("PRAGMA kdf_iter = " + KDF_ITERATIONS);
            st.execute("PRAGMA hmac_algorithm = " + HMAC_ALGORITHM);
            st.execute("PRAGMA kdf_algorithm = " + KDF_ALGORITHM);
            st.execute("PRAGMA key = " + dbKey.sqlCipherLiteral());
        }
    }
}
