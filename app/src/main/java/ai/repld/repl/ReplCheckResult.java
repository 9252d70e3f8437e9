package ai.repld.repl;

import org.jetbrains.annotations.Nullable;

/** Outcome of checking a code line against a session without advancing it. */
public sealed interface ReplCheckResult {

    /** The line is complete and may be compiled. */
    record Ok() implements ReplCheckResult {}

    /** The line is a partial fragment; the client should ask for more input. */
    record Incomplete() implements ReplCheckResult {}

    record Error(String message, @Nullable MessageLocation location) implements ReplCheckResult {
        public Error(String message) {
            this(message, null);
        }
    }
}
