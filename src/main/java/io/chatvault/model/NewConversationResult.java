package io.chatvault.model;

public record NewConversationResult(Outcome outcome, Long conversationId) {

    public static NewConversationResult created(long conversationId) {
        return new NewConversationResult(Outcome.CREATED, conversationId);
    }

    public static NewConversationResult refused(Outcome outcome) {
        return new NewConversationResult(outcome, null);
    }

    public boolean created() {
        return outcome == Outcome.CREATED;
    }

    public enum Outcome {
        CREATED,
        USER_NOT_FOUND
    }
}
