package io.chatvault.storage;

import io.chatvault.security.KeyMaterial;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Opens SQLite connections and reads pragmas. Pragmas an engine build does not know
 * return no result set at all, which {@link #pragmaRows} reports as an empty list.
 */
public final class SqliteEngine {
    /** SQLITE_NOTADB: the engine could not read page 1, which for a keyed file means a wrong key. */
    static final int SQLITE_NOTADB = 26;

    private SqliteEngine() {
    }

    public static Connection openPlain(Path file) throws SQLException {
        return DriverManager.getConnection(jdbcUrl(file));
    }

    public static Connection openEncrypted(Path file, KeyMaterial dbKey) throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl(file));
        try {
            CipherParameters.apply(conn, dbKey);
            return conn;
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
    }

    static void applyCommonPragmas(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys=ON");
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("PRAGMA temp_store=MEMORY");
            st.execute("PRAGMA cache_size=-80000");
            st.execute("PRAGMA busy_timeout=5000");
        }
        validatePragma(conn, "foreign_keys", "1");
        validatePragma(conn, "journal_mode", "wal");
    }

    public static Optional<String> pragmaValue(Connection conn, String pragma) throws SQLException {
        List<String> rows = pragmaRows(conn, pragma);
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    public static List<String> pragmaRows(Connection conn, String pragma) throws SQLException {
        List<String> out = new ArrayList<>();
        try (Statement st = conn.createStatement()) {
            if (!st.execute("PRAGMA " + pragma)) {
                return out;
            }
            try (ResultSet rs = st.getResultSet()) {
                while (rs != null && rs.next()) {
                    out.add(rs.getString(1));
                }
            }
        }
        return out;
    }

    static boolean isNotADatabase(SQLException e) {
        return e.getErrorCode() == SQLITE_NOTADB
                || (e.getMessage() != null && e.getMessage().contains("file is not a database"));
    }

    private static void validatePragma(Connection conn, String pragma, String expected) throws SQLException {
        String actual = pragmaValue(conn, pragma).orElse(null);
        if (actual == null || !actual.equalsIgnoreCase(expected)) {
            throw new IllegalStateException(
                    "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
            );
        }
    }

    private static String jdbcUrl(Path file) {
        return "jdbc:sqlite:" + file.toAbsolutePath();
    }
}
