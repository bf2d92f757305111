package io.chatvault.model;

public record ConversationView(long conversationId, long userId, String title, long createdAtMs, long updatedAtMs) {
}
