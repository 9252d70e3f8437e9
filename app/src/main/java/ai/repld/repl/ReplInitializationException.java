package ai.repld.repl;

/** Raised when no usable REPL engine could be constructed for the daemon. */
public final class ReplInitializationException extends IllegalStateException {

    public enum Reason {
        /** No engine plugin (or one of its dependencies) was found. */
        NOT_FOUND,
        /** More than one engine plugin was found. */
        AMBIGUOUS,
        /** An engine was found but failed to start. */
        FAILED
    }

    private final Reason reason;

    public ReplInitializationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ReplInitializationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
