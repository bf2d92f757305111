package io.chatvault.model;

public record UserView(
        long userId,
        String name,
        String handle,
        String email,
        String username,
        Role role,
        long createdAtMs,
        Long lastLoginAtMs
) {
}
