package io.chatvault.model;

/**
 * Account fields supplied at user creation or signup time. {@code handle} defaults to the
 * username when blank.
 */
public record NewUser(String name, String handle, String email, String username, String password, Role role) {

    public NewUser {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be blank");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("password must not be empty");
        }
        username = username.trim();
        handle = handle == null || handle.isBlank() ? username : handle.trim();
        name = name == null || name.isBlank() ? username : name.trim();
        email = email == null || email.isBlank() ? null : email.trim();
        role = role == null ? Role.USER : role;
    }

    public static NewUser of(String username, String password) {
        return new NewUser(null, null, null, username, password, Role.USER);
    }

    public static NewUser admin(String username, String password) {
        return new NewUser(null, null, null, username, password, Role.ADMIN);
    }

    @Override
    public String toString() {
        return "NewUser[username=" + username + ", handle=" + handle + ", role=" + role + "]";
    }
}
