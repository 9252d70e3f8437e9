package ai.repld.repl;

import org.jetbrains.annotations.Nullable;

/** Sink for diagnostics produced while checking or compiling a code line. */
public interface MessageCollector {

    void report(MessageSeverity severity, String message, @Nullable MessageLocation location);

    default void report(MessageSeverity severity, String message) {
        report(severity, message, null);
    }

    /** Returns true if any error-severity message was reported since the last {@link #clear()}. */
    boolean hasErrors();

    void clear();

    MessageCollector NONE = new MessageCollector() {
        @Override
        public void report(MessageSeverity severity, String message, @Nullable MessageLocation location) {}

        @Override
        public boolean hasErrors() {
            return false;
        }

        @Override
        public void clear() {}
    };
}
