package io.chatvault.model;

public record NewMessageResult(Outcome outcome, Long messageId) {

    public static NewMessageResult added(long messageId) {
        return new NewMessageResult(Outcome.ADDED, messageId);
    }

    public static NewMessageResult refused(Outcome outcome) {
        return new NewMessageResult(outcome, null);
    }

    public boolean added() {
        return outcome == Outcome.ADDED;
    }

    public enum Outcome {
        ADDED,
        CONVERSATION_NOT_FOUND
    }
}
