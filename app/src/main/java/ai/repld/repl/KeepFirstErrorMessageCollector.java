package ai.repld.repl;

import java.io.PrintStream;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Forwards every diagnostic to an underlying sink and additionally remembers the first error.
 *
 * <p>The first-error record belongs to this instance and survives {@link #clear()}, which only resets the
 * underlying sink. Use a new instance per check/compile call to get per-call isolation.
 */
public final class KeepFirstErrorMessageCollector implements MessageCollector {
    private final MessageCollector inner;

    @Nullable
    private FirstErrorRecord firstError;

    public KeepFirstErrorMessageCollector(MessageCollector inner) {
        this.inner = inner;
    }

    public KeepFirstErrorMessageCollector(PrintStream compilerMessagesStream) {
        this(new PrintingMessageCollector(compilerMessagesStream, MessageRenderer.WITHOUT_PATHS, false));
    }

    @Override
    public void report(MessageSeverity severity, String message, @Nullable MessageLocation location) {
        synchronized (this) {
            if (firstError == null && severity.isError()) {
                firstError = new FirstErrorRecord(message, location);
            }
        }
        inner.report(severity, message, location);
    }

    @Override
    public boolean hasErrors() {
        return inner.hasErrors();
    }

    @Override
    public void clear() {
        inner.clear();
    }

    public synchronized Optional<FirstErrorRecord> firstError() {
        return Optional.ofNullable(firstError);
    }

    @Nullable
    public synchronized String firstErrorMessage() {
        return firstError == null ? null : firstError.message();
    }

    @Nullable
    public synchronized MessageLocation firstErrorLocation() {
        return firstError == null ? null : firstError.location();
    }
}
