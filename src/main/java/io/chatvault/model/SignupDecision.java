package io.chatvault.model;

public record SignupDecision(Outcome outcome, Long userId) {

    public static SignupDecision approved(long userId) {
        return new SignupDecision(Outcome.APPROVED, userId);
    }

    public static SignupDecision of(Outcome outcome) {
        return new SignupDecision(outcome, null);
    }

    public boolean succeeded() {
        return outcome == Outcome.APPROVED || outcome == Outcome.REJECTED;
    }

    public enum Outcome {
        APPROVED,
        REJECTED,
        NOT_FOUND,
        NOT_PENDING,
        NOT_AUTHORIZED,
        DUPLICATE_USERNAME,
        DUPLICATE_HANDLE,
        DUPLICATE_EMAIL
    }
}
