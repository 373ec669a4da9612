package com.lwactors;

/**
 * Structural failure of the mailbox machinery, as opposed to a domain error
 * returned by an action.
 *
 * <p>Callers receive it through the {@link ActorErrorMapper} supplied when the
 * actor was spawned, converted into their own error type.
 */
public class ActorException extends RuntimeException {

    /**
     * The two structural failure kinds.
     */
    public enum Kind {
        /**
         * The mailbox could not accept the action: the handle was closed, the
         * actor had already terminated, or a bounded mailbox stayed full.
         * The action was never applied.
         */
        SUBMISSION_FAILED("Cannot send message to actor"),

        /**
         * The reply was abandoned before an answer was delivered. The action
         * may or may not have been applied; callers cannot tell which.
         */
        REPLY_LOST("Cannot wait for an answer");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Kind kind;
    private final String actorName;

    /**
     * Creates a new ActorException.
     *
     * @param kind the failure kind
     * @param actorName the name of the actor the failure concerns
     */
    public ActorException(Kind kind, String actorName) {
        super(kind.getDescription() + " [" + actorName + "]");
        this.kind = kind;
        this.actorName = actorName;
    }

    /**
     * Creates a new ActorException with a cause.
     *
     * @param kind the failure kind
     * @param actorName the name of the actor the failure concerns
     * @param cause the underlying failure
     */
    public ActorException(Kind kind, String actorName, Throwable cause) {
        super(kind.getDescription() + " [" + actorName + "]", cause);
        this.kind = kind;
        this.actorName = actorName;
    }

    public static ActorException submissionFailed(String actorName) {
        return new ActorException(Kind.SUBMISSION_FAILED, actorName);
    }

    public static ActorException submissionFailed(String actorName, Throwable cause) {
        return new ActorException(Kind.SUBMISSION_FAILED, actorName, cause);
    }

    public static ActorException replyLost(String actorName) {
        return new ActorException(Kind.REPLY_LOST, actorName);
    }

    public static ActorException replyLost(String actorName, Throwable cause) {
        return new ActorException(Kind.REPLY_LOST, actorName, cause);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the name of the actor where the failure occurred.
     *
     * @return the actor name
     */
    public String getActorName() {
        return actorName;
    }

    public boolean isSubmissionFailure() {
        return kind == Kind.SUBMISSION_FAILED;
    }

    public boolean isReplyLost() {
        return kind == Kind.REPLY_LOST;
    }
}
