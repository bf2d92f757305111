package io.chatvault.storage;

import io.chatvault.model.ConversationView;
import io.chatvault.model.MessageView;
import io.chatvault.model.NewConversationResult;
import io.chatvault.model.NewMessageResult;
import io.chatvault.model.SenderType;
import io.chatvault.model.Tier;
import io.chatvault.security.FieldCodec;
import io.chatvault.storage.AuditLog.AuditEvent;
import io.chatvault.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Saved conversations and their messages. Message bodies are sealed when the tier
 * requires it.
 */
public final class ConversationStore {
    private final Connection conn;
    private final ContentColumns content;

    public ConversationStore(Connection conn, Tier tier, FieldCodec codec) {
        this.conn = conn;
        this.content = new ContentColumns(tier, codec, "message");
    }

    /** The owner is checked in the same transaction as the insert. */
    public NewConversationResult createConversation(long userId, String title) {
        long now = System.currentTimeMillis();
        try {
            conn.setAutoCommit(false);
            try {
                if (!Rows.exists(conn, "SELECT 1 FROM user_profile WHERE id=?", userId)) {
                    conn.rollback();
                    return NewConversationResult.refused(NewConversationResult.Outcome.USER_NOT_FOUND);
                }
                try (PreparedStatement ps = conn.prepareStatement("""
                        INSERT INTO saved_conversation(user_id, title, created_at_ms, updated_at_ms)
                        VALUES (?, ?, ?, ?)
                        """)) {
                    ps.setLong(1, userId);
                    ps.setString(2, normalizeTitle(title));
                    ps.setLong(3, now);
                    ps.setLong(4, now);
                    ps.executeUpdate();
                }
                long conversationId = Rows.lastInsertId(conn);
                conn.commit();
                return NewConversationResult.created(conversationId);
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to create conversation for user " + userId, e);
        }
    }

    /** @return false when the conversation does not exist */
    public boolean renameConversation(long conversationId, String title) {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE saved_conversation SET title=?, updated_at_ms=? WHERE id=?")) {
            ps.setString(1, normalizeTitle(title));
            ps.setLong(2, System.currentTimeMillis());
            ps.setLong(3, conversationId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to rename conversation " + conversationId, e);
        }
    }

    /** Messages first, then the conversation, in one transaction. */
    public boolean deleteConversation(long conversationId, Long actorUserId) {
        try {
            conn.setAutoCommit(false);
            try {
                int removedMessages;
                int removed;
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM message WHERE conversation_id=?")) {
                    ps.setLong(1, conversationId);
                    removedMessages = ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM saved_conversation WHERE id=?")) {
                    ps.setLong(1, conversationId);
                    removed = ps.executeUpdate();
                }
                if (removed == 0) {
                    conn.rollback();
                    return false;
                }
                AuditLog.append(conn, new AuditEvent(actorUserId, "conversation.delete",
                        "conversation:" + conversationId, Map.of("messages", removedMessages)));
                conn.commit();
                return true;
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to delete conversation " + conversationId, e);
        }
    }

    /** Newest first. */
    public List<ConversationView> listConversations(long userId, int limit) {
        try (PreparedStatement ps = conn.prepareStatement("""
                SELECT id, user_id, title, created_at_ms, updated_at_ms
                FROM saved_conversation
                WHERE user_id=?
                ORDER BY created_at_ms DESC, id DESC
                LIMIT ?
                """)) {
            ps.setLong(1, userId);
            ps.setInt(2, Math.max(1, limit));
            List<ConversationView> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ConversationView(
                            rs.getLong("id"),
                            rs.getLong("user_id"),
                            rs.getString("title"),
                            rs.getLong("created_at_ms"),
                            rs.getLong("updated_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list conversations for user " + userId, e);
        }
    }

    public NewMessageResult addMessage(
            long conversationId,
            SenderType senderType,
            Long senderId,
            String text,
            Map<String, Object> metadata
    ) {
        long now = System.currentTimeMillis();
        try {
            conn.setAutoCommit(false);
            try {
                if (!Rows.exists(conn, "SELECT 1 FROM saved_conversation WHERE id=?", conversationId)) {
                    conn.rollback();
                    return NewMessageResult.refused(NewMessageResult.Outcome.CONVERSATION_NOT_FOUND);
                }
                try (PreparedStatement ps = conn.prepareStatement("""
                        INSERT INTO message(conversation_id, sender_type, sender_id, metadata, created_at_ms)
                        VALUES (?, ?, ?, ?, ?)
                        """)) {
                    ps.setLong(1, conversationId);
                    ps.setString(2, senderType.dbValue());
                    Rows.setNullableLong(ps, 3, senderId);
                    ps.setString(4, Jsons.toCompactJson(metadata == null ? Map.of() : metadata));
                    ps.setLong(5, now);
                    ps.executeUpdate();
                }
                long messageId = Rows.lastInsertId(conn);
                content.write(conn, messageId, text);
                try (PreparedStatement ps = conn.prepareStatement(
                        "UPDATE saved_conversation SET updated_at_ms=? WHERE id=?")) {
                    ps.setLong(1, now);
                    ps.setLong(2, conversationId);
                    ps.executeUpdate();
                }
                conn.commit();
                return NewMessageResult.added(messageId);
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to add message to conversation " + conversationId, e);
        }
    }

    /** Oldest first. Undecryptable bodies come back as failed {@code ReadableText}. */
    public List<MessageView> listMessages(long conversationId, int limit) {
        try (PreparedStatement ps = conn.prepareStatement("""
                SELECT id, conversation_id, sender_type, sender_id,
                       content, content_ct, content_nonce, content_key_id, metadata, created_at_ms
                FROM message
                WHERE conversation_id=?
                ORDER BY id ASC
                LIMIT ?
                """)) {
            ps.setLong(1, conversationId);
            ps.setInt(2, Math.max(1, limit));
            List<MessageView> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new MessageView(
                            rs.getLong("id"),
                            rs.getLong("conversation_id"),
                            SenderType.fromDb(rs.getString("sender_type")),
                            Rows.nullableLong(rs, "sender_id"),
                            content.read(rs),
                            Jsons.toMap(rs.getString("metadata")),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list messages of conversation " + conversationId, e);
        }
    }

    private static String normalizeTitle(String title) {
        return title == null || title.isBlank() ? "New conversation" : title.trim();
    }
}
