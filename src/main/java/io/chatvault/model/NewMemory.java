package io.chatvault.model;

public record NewMemory(
        MemoryScope scope,
        Long userId,
        Long conversationId,
        String subject,
        String content,
        int importance,
        Long retentionUntilMs
) {
    public NewMemory {
        if (scope == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
        if (scope == MemoryScope.USER && userId == null) {
            throw new IllegalArgumentException("user-scoped memory requires userId");
        }
        if (scope == MemoryScope.CONVERSATION && conversationId == null) {
            throw new IllegalArgumentException("conversation-scoped memory requires conversationId");
        }
        content = content == null ? "" : content;
    }
}
