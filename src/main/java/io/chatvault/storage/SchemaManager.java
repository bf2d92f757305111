package io.chatvault.storage;

import io.chatvault.model.Tier;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Creates the schema of a new database file and tags it with its tier. Applying it twice
 * is harmless; the tier recorded on first application is never overwritten.
 */
public final class SchemaManager {
    public static final String SCHEMA_VERSION = "1";
    public static final String STRICT_REJECTION = "strict mode requires encrypted content";

    private static final List<String> TABLES = List.of(
            """
            CREATE TABLE IF NOT EXISTS meta (
                key TEXT PRIMARY KEY,
                value TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS user_profile (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL,
                handle TEXT NOT NULL UNIQUE,
                email TEXT UNIQUE,
                created_at_ms INTEGER NOT NULL,
                updated_at_ms INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS user_auth (
                id INTEGER PRIMARY KEY,
                username TEXT NOT NULL UNIQUE,
                role TEXT NOT NULL DEFAULT 'user' CHECK (role IN ('user', 'admin')),
                pw_salt BLOB NOT NULL,
                pw_hash BLOB NOT NULL,
                pw_params TEXT NOT NULL,
                created_at_ms INTEGER NOT NULL,
                updated_at_ms INTEGER NOT NULL,
                last_login_at_ms INTEGER,
                FOREIGN KEY(id) REFERENCES user_profile(id) ON DELETE CASCADE
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS signup_request (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL,
                handle TEXT NOT NULL,
                username TEXT NOT NULL,
                email TEXT,
                pw_salt BLOB NOT NULL,
                pw_hash BLOB NOT NULL,
                pw_params TEXT NOT NULL,
                created_at_ms INTEGER NOT NULL,
                status TEXT NOT NULL DEFAULT 'pending' CHECK (status IN ('pending', 'approved', 'rejected')),
                decided_by INTEGER,
                decided_at_ms INTEGER,
                note TEXT,
                FOREIGN KEY(decided_by) REFERENCES user_profile(id) ON DELETE SET NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS saved_conversation (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                user_id INTEGER NOT NULL,
                title TEXT NOT NULL,
                created_at_ms INTEGER NOT NULL,
                updated_at_ms INTEGER NOT NULL,
                FOREIGN KEY(user_id) REFERENCES user_profile(id) ON DELETE CASCADE
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS message (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                conversation_id INTEGER NOT NULL,
                sender_type TEXT NOT NULL CHECK (sender_type IN ('user', 'assistant', 'system', 'tool')),
                sender_id INTEGER,
                content TEXT,
                content_ct BLOB,
                content_nonce BLOB,
                content_key_id INTEGER,
                metadata TEXT,
                created_at_ms INTEGER NOT NULL,
                FOREIGN KEY(conversation_id) REFERENCES saved_conversation(id) ON DELETE CASCADE
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS persistent_memory (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                scope TEXT NOT NULL CHECK (scope IN ('user', 'conversation', 'global')),
                user_id INTEGER,
                conversation_id INTEGER,
                subject TEXT,
                content TEXT,
                content_ct BLOB,
                content_nonce BLOB,
                content_key_id INTEGER,
                importance INTEGER NOT NULL DEFAULT 0,
                reinforced_at_ms INTEGER,
                created_at_ms INTEGER NOT NULL,
                retention_until_ms INTEGER,
                FOREIGN KEY(user_id) REFERENCES user_profile(id) ON DELETE CASCADE,
                FOREIGN KEY(conversation_id) REFERENCES saved_conversation(id) ON DELETE CASCADE
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS file (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                kind TEXT NOT NULL CHECK (kind IN ('image', 'audio', 'video', 'doc', 'other')),
                mime TEXT NOT NULL,
                sha256 TEXT NOT NULL UNIQUE,
                size_bytes INTEGER NOT NULL,
                thumb_sha256 TEXT,
                original_name TEXT,
                ref_count INTEGER NOT NULL DEFAULT 1,
                created_at_ms INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS audit_log (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                ts_ms INTEGER NOT NULL,
                actor_user_id INTEGER,
                action TEXT NOT NULL,
                subject TEXT NOT NULL,
                details TEXT NOT NULL,
                prev_hash TEXT NOT NULL,
                hash TEXT NOT NULL
            )
            """
    );

    private static final List<String> INDEXES = List.of(
            "CREATE INDEX IF NOT EXISTS idx_conversation_user ON saved_conversation(user_id, updated_at_ms)",
            "CREATE INDEX IF NOT EXISTS idx_message_conversation ON message(conversation_id, created_at_ms)",
            "CREATE INDEX IF NOT EXISTS idx_memory_scope ON persistent_memory(scope, user_id, conversation_id)",
            "CREATE INDEX IF NOT EXISTS idx_signup_status ON signup_request(status, created_at_ms)"
    );

    private static final List<String> GUARDED_TABLES = List.of("message", "persistent_memory");

    private SchemaManager() {
    }

    public static void apply(Connection conn, Tier tier) throws SQLException {
        long now = System.currentTimeMillis();
        conn.setAutoCommit(false);
        try (Statement st = conn.createStatement()) {
            for (String ddl : TABLES) {
                st.execute(ddl);
            }
            for (String ddl : INDEXES) {
                st.execute(ddl);
            }
            for (String table : GUARDED_TABLES) {
                st.execute(guardTrigger(table, "INSERT"));
                st.execute(guardTrigger(table, "UPDATE"));
            }
            insertMetaIfAbsent(conn, "schema_version", SCHEMA_VERSION);
            insertMetaIfAbsent(conn, "db_mode", tier.dbValue());
            insertMetaIfAbsent(conn, "created_at_ms", Long.toString(now));
            upsertMeta(conn, "updated_at_ms", Long.toString(now));
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    /**
     * Reads one meta value. Throws when the meta table itself is missing, which callers
     * treat differently from a missing key.
     */
    public static Optional<String> readMeta(Connection conn, String key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT value FROM meta WHERE key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(rs.getString(1));
            }
        }
    }

    static void upsertMeta(Connection conn, String key, String value) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("""
                INSERT INTO meta(key, value) VALUES (?, ?)
                ON CONFLICT(key) DO UPDATE SET value=excluded.value
                """)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
        }
    }

    private static void insertMetaIfAbsent(Connection conn, String key, String value) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT OR IGNORE INTO meta(key, value) VALUES (?, ?)")) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
        }
    }

    // Active only while meta says strict, so the same schema serves every tier.
    private static String guardTrigger(String table, String event) {
        String name = "trg_" + table + "_strict_" + event.toLowerCase(Locale.ROOT);
        return """
                CREATE TRIGGER IF NOT EXISTS %s
                BEFORE %s ON %s
                WHEN (SELECT value FROM meta WHERE key='db_mode')='strict' AND NEW.content IS NOT NULL
                BEGIN
                    SELECT RAISE(ABORT, '%s');
                END
                """.formatted(name, event, table, STRICT_REJECTION);
    }
}
