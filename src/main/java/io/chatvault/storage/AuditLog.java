package io.chatvault.storage;

import io.chatvault.security.SensitiveDataMasker;
import io.chatvault.util.Hashing;
import io.chatvault.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only, hash-chained audit trail kept in the {@code audit_log} table. Rows are
 * appended on the caller's connection so they commit or roll back with the change they
 * describe.
 */
public final class AuditLog {

    private AuditLog() {
    }

    public static void append(Connection conn, AuditEvent event) throws SQLException {
        long now = System.currentTimeMillis();
        String detailsJson = Jsons.toCompactJson(SensitiveDataMasker.masked(event.details()));
        String prevHash = lastHash(conn);
        String hash = rowHash(now, event.actorUserId(), event.action(), event.subject(), detailsJson, prevHash);
        try (PreparedStatement ps = conn.prepareStatement("""
                INSERT INTO audit_log(ts_ms, actor_user_id, action, subject, details, prev_hash, hash)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """)) {
            ps.setLong(1, now);
            Rows.setNullableLong(ps, 2, event.actorUserId());
            ps.setString(3, event.action());
            ps.setString(4, event.subject());
            ps.setString(5, detailsJson);
            ps.setString(6, prevHash);
            ps.setString(7, hash);
            ps.executeUpdate();
        }
    }

    /** Walks the whole chain in id order and stops at the first broken link. */
    public static ChainVerification verify(Connection conn) {
        String expectedPrev = "";
        long checked = 0;
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("""
                     SELECT id, ts_ms, actor_user_id, action, subject, details, prev_hash, hash
                     FROM audit_log ORDER BY id
                     """)) {
            while (rs.next()) {
                long id = rs.getLong("id");
                Long actorUserId = Rows.nullableLong(rs, "actor_user_id");
                String prevHash = rs.getString("prev_hash");
                if (!expectedPrev.equals(prevHash)) {
                    return ChainVerification.broken(checked, id, "prev_hash does not link to the previous row");
                }
                String recomputed = rowHash(
                        rs.getLong("ts_ms"),
                        actorUserId,
                        rs.getString("action"),
                        rs.getString("subject"),
                        rs.getString("details"),
                        prevHash
                );
                String stored = rs.getString("hash");
                if (!recomputed.equals(stored)) {
                    return ChainVerification.broken(checked, id, "hash does not match row contents");
                }
                expectedPrev = stored;
                checked++;
            }
            return new ChainVerification(true, checked, null, "");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to verify audit chain", e);
        }
    }

    private static String lastHash(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT hash FROM audit_log ORDER BY id DESC LIMIT 1")) {
            return rs.next() ? rs.getString(1) : "";
        }
    }

    // Details are hashed in their parsed form so a stored row hashes identically on re-read.
    private static String rowHash(
            long tsMs,
            Long actorUserId,
            String action,
            String subject,
            String detailsJson,
            String prevHash
    ) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("ts_ms", tsMs);
        row.put("actor_user_id", actorUserId);
        row.put("action", action);
        row.put("subject", subject);
        row.put("details", Jsons.toMap(detailsJson));
        row.put("prev_hash", prevHash);
        return Hashing.sha256Hex(Jsons.toCompactJson(row));
    }

    public record AuditEvent(Long actorUserId, String action, String subject, Map<String, Object> details) {
        public AuditEvent {
            if (action == null || action.isBlank()) {
                throw new IllegalArgumentException("action must not be blank");
            }
            subject = subject == null ? "" : subject;
            details = details == null ? Map.of() : details;
        }

        public static AuditEvent of(Long actorUserId, String action, String subject) {
            return new AuditEvent(actorUserId, action, subject, Map.of());
        }
    }

    public record ChainVerification(boolean valid, long checkedRows, Long brokenAtId, String reason) {
        static ChainVerification broken(long checkedRows, long rowId, String reason) {
            return new ChainVerification(false, checkedRows, rowId, reason);
        }
    }
}
