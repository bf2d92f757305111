package io.chatvault.model;

public record MemoryView(
        long memoryId,
        MemoryScope scope,
        Long userId,
        Long conversationId,
        String subject,
        ReadableText body,
        int importance,
        Long reinforcedAtMs,
        long createdAtMs,
        Long retentionUntilMs
) {
}
