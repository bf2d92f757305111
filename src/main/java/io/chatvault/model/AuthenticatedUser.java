package io.chatvault.model;

public record AuthenticatedUser(long userId, String username, Role role) {
}
