package io.chatvault.storage;

import io.chatvault.model.MemoryScope;
import io.chatvault.model.MemoryView;
import io.chatvault.model.NewMemory;
import io.chatvault.model.Tier;
import io.chatvault.security.FieldCodec;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Long-lived notes the assistant may recall across conversations. Content follows the
 * same sealing rules as message bodies.
 */
public final class MemoryStore {
    private final Connection conn;
    private final ContentColumns content;

    public MemoryStore(Connection conn, Tier tier, FieldCodec codec) {
        this.conn = conn;
        this.content = new ContentColumns(tier, codec, "persistent_memory");
    }

    public long addMemory(NewMemory memory) {
        try {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement("""
                        INSERT INTO persistent_memory(scope, user_id, conversation_id, subject,
                                                      importance, created_at_ms, retention_until_ms)
                        VALUES (?, ?, ?, ?, ?, ?, ?)
                        """)) {
                    ps.setString(1, memory.scope().dbValue());
                    Rows.setNullableLong(ps, 2, memory.userId());
                    Rows.setNullableLong(ps, 3, memory.conversationId());
                    Rows.setNullableString(ps, 4, memory.subject());
                    ps.setInt(5, memory.importance());
                    ps.setLong(6, System.currentTimeMillis());
                    Rows.setNullableLong(ps, 7, memory.retentionUntilMs());
                    ps.executeUpdate();
                }
                long memoryId = Rows.lastInsertId(conn);
                content.write(conn, memoryId, memory.content());
                conn.commit();
                return memoryId;
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to add " + memory.scope().dbValue() + " memory", e);
        }
    }

    /**
     * Unexpired memories, most important first. Null filters match anything.
     */
    public List<MemoryView> listMemories(Optional<MemoryScope> scope, Long userId, Long conversationId, int limit) {
        StringBuilder sql = new StringBuilder("""
                SELECT id, scope, user_id, conversation_id, subject,
                       content, content_ct, content_nonce, content_key_id,
                       importance, reinforced_at_ms, created_at_ms, retention_until_ms
                FROM persistent_memory
                WHERE (retention_until_ms IS NULL OR retention_until_ms > ?)
                """);
        if (scope.isPresent()) {
            sql.append(" AND scope=?");
        }
        if (userId != null) {
            sql.append(" AND user_id=?");
        }
        if (conversationId != null) {
            sql.append(" AND conversation_id=?");
        }
        sql.append(" ORDER BY importance DESC, COALESCE(reinforced_at_ms, created_at_ms) DESC, id DESC LIMIT ?");
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setLong(i++, System.currentTimeMillis());
            if (scope.isPresent()) {
                ps.setString(i++, scope.get().dbValue());
            }
            if (userId != null) {
                ps.setLong(i++, userId);
            }
            if (conversationId != null) {
                ps.setLong(i++, conversationId);
            }
            ps.setInt(i, Math.max(1, limit));
            List<MemoryView> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new MemoryView(
                            rs.getLong("id"),
                            MemoryScope.fromDb(rs.getString("scope")),
                            Rows.nullableLong(rs, "user_id"),
                            Rows.nullableLong(rs, "conversation_id"),
                            rs.getString("subject"),
                            content.read(rs),
                            rs.getInt("importance"),
                            Rows.nullableLong(rs, "reinforced_at_ms"),
                            rs.getLong("created_at_ms"),
                            Rows.nullableLong(rs, "retention_until_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list memories", e);
        }
    }

    /** Bumps importance by one and stamps the reinforcement time. */
    public boolean reinforceMemory(long memoryId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE persistent_memory SET importance=importance+1, reinforced_at_ms=? WHERE id=?")) {
            ps.setLong(1, System.currentTimeMillis());
            ps.setLong(2, memoryId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reinforce memory " + memoryId, e);
        }
    }

    public boolean deleteMemory(long memoryId) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM persistent_memory WHERE id=?")) {
            ps.setLong(1, memoryId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete memory " + memoryId, e);
        }
    }

    /** Removes memories whose retention ended at or before {@code nowMs}. */
    public int purgeExpired(long nowMs) {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM persistent_memory WHERE retention_until_ms IS NOT NULL AND retention_until_ms <= ?")) {
            ps.setLong(1, nowMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge expired memories", e);
        }
    }
}
