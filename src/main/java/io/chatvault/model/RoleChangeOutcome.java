package io.chatvault.model;

public enum RoleChangeOutcome {
    CHANGED,
    UNCHANGED,
    NOT_FOUND,
    LAST_ADMIN
}
