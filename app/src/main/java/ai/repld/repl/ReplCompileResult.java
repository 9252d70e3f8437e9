package ai.repld.repl;

import org.jetbrains.annotations.Nullable;

/** Outcome of compiling a code line into a session. */
public sealed interface ReplCompileResult {

    /**
     * The line compiled and the session advanced to {@code generation}.
     *
     * @param line the compiled line
     * @param generation the session generation after this line
     * @param artifact engine-specific description of what was produced
     */
    record CompiledClasses(ReplCodeLine line, int generation, Object artifact) implements ReplCompileResult {}

    /** The line is a partial fragment; nothing was compiled. */
    record Incomplete() implements ReplCompileResult {}

    /** Compilation failed; the session is unchanged. */
    record Error(String message, @Nullable MessageLocation location) implements ReplCompileResult {
        public Error(String message) {
            this(message, null);
        }
    }
}
