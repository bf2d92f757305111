package io.chatvault.model;

public record SignupView(
        long requestId,
        String name,
        String handle,
        String username,
        String email,
        SignupStatus status,
        long createdAtMs,
        Long decidedBy,
        Long decidedAtMs,
        String note
) {
}
