package io.chatvault.model;

public record CreateUserResult(Outcome outcome, Long userId) {

    public static CreateUserResult created(long userId) {
        return new CreateUserResult(Outcome.CREATED, userId);
    }

    public static CreateUserResult refused(Outcome outcome) {
        return new CreateUserResult(outcome, null);
    }

    public boolean created() {
        return outcome == Outcome.CREATED;
    }

    public enum Outcome {
        CREATED,
        DUPLICATE_USERNAME,
        DUPLICATE_HANDLE,
        DUPLICATE_EMAIL
    }
}
