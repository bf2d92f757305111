package io.chatvault.storage;

import io.chatvault.model.Tier;
import io.chatvault.security.FieldCodec;
import io.chatvault.security.KeyKind;
import io.chatvault.security.KeyMaterial;
import io.chatvault.security.PasswordHasher;
import io.chatvault.util.Hashing;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

final class StorageFixtures {
    static final PasswordHasher FAST_HASHER = new PasswordHasher(new PasswordHasher.Params(1024, 8, 1, 32));

    private StorageFixtures() {
    }

    /** Plaintext file carrying the schema of {@code tier}; stands in for an encrypted file in tests. */
    static Connection schemaDatabase(Path file, Tier tier) throws SQLException {
        Connection conn = SqliteEngine.openPlain(file);
        SqliteEngine.applyCommonPragmas(conn);
        SchemaManager.apply(conn, tier);
        return conn;
    }

    static Connection encryptedSchemaDatabase(Path file, Tier tier, KeyMaterial dbKey) throws SQLException {
        Connection conn = SqliteEngine.openEncrypted(file, dbKey);
        SqliteEngine.applyCommonPragmas(conn);
        SchemaManager.apply(conn, tier);
        return conn;
    }

    static KeyMaterial databaseKey(String hex) {
        return new KeyMaterial(KeyKind.DATABASE, Hashing.fromHex(hex), KeyMaterial.Source.ENVIRONMENT);
    }

    /** Points an index at a column its entries were not built from; integrity_check reports the rows. */
    static void breakIndex(Connection conn) throws SQLException {
        exec(conn, "CREATE TABLE scratch(a INTEGER, b INTEGER)");
        exec(conn, "CREATE INDEX scratch_a ON scratch(a)");
        exec(conn, "INSERT INTO scratch(a, b) VALUES (1, 100), (2, 200)");
        exec(conn, "PRAGMA writable_schema=ON");
        exec(conn, "UPDATE sqlite_master SET sql='CREATE INDEX scratch_a ON scratch(b)' WHERE name='scratch_a'");
        exec(conn, "PRAGMA writable_schema=OFF");
    }

    static FieldCodec randomCodec() {
        byte[] raw = new byte[KeyMaterial.KEY_BYTES];
        new SecureRandom().nextBytes(raw);
        return new FieldCodec(new KeyMaterial(KeyKind.FIELD, raw, KeyMaterial.Source.EPHEMERAL));
    }

    static void writeGarbage(Path file) throws Exception {
        StringBuilder sb = new StringBuilder();
        while (sb.length() < 8192) {
            sb.append("this file is not a sqlite database; ");
        }
        Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);
    }

    static long count(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    static void exec(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }
}
