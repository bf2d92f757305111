package io.chatvault.model;

public enum DeleteUserOutcome {
    DELETED,
    NOT_FOUND,
    LAST_ADMIN
}
