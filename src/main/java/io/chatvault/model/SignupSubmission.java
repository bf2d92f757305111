package io.chatvault.model;

/**
 * Result of a signup. {@code requestId} is set for a queued request, {@code userId} when
 * the policy allowed the account to be created directly.
 */
public record SignupSubmission(Outcome outcome, Long requestId, Long userId) {

    public static SignupSubmission submitted(long requestId) {
        return new SignupSubmission(Outcome.SUBMITTED, requestId, null);
    }

    public static SignupSubmission created(long userId) {
        return new SignupSubmission(Outcome.CREATED, null, userId);
    }

    public static SignupSubmission refused(Outcome outcome) {
        return new SignupSubmission(outcome, null, null);
    }

    public boolean accepted() {
        return outcome == Outcome.SUBMITTED || outcome == Outcome.CREATED;
    }

    public enum Outcome {
        SUBMITTED,
        CREATED,
        USERNAME_TAKEN,
        HANDLE_TAKEN,
        EMAIL_TAKEN
    }
}
