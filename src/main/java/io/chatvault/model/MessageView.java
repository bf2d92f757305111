package io.chatvault.model;

import java.util.Map;

public record MessageView(
        long messageId,
        long conversationId,
        SenderType senderType,
        Long senderId,
        ReadableText body,
        Map<String, Object> metadata,
        long createdAtMs
) {
}
