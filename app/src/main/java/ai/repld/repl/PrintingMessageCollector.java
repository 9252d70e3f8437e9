package ai.repld.repl;

import java.io.PrintStream;
import org.jetbrains.annotations.Nullable;

/** Renders every diagnostic to a stream and remembers whether an error was seen. */
public final class PrintingMessageCollector implements MessageCollector {
    private final PrintStream out;
    private final MessageRenderer renderer;
    private final boolean verbose;
    private volatile boolean hasErrors = false;

    public PrintingMessageCollector(PrintStream out, MessageRenderer renderer, boolean verbose) {
        this.out = out;
        this.renderer = renderer;
        this.verbose = verbose;
    }

    @Override
    public void report(MessageSeverity severity, String message, @Nullable MessageLocation location) {
        if (severity.isError()) {
            hasErrors = true;
        }
        if (!verbose && severity.isVerboseOnly()) {
            return;
        }
        synchronized (out) {
            out.println(renderer.render(severity, message, location));
            out.flush();
        }
    }

    @Override
    public boolean hasErrors() {
        return hasErrors;
    }

    @Override
    public void clear() {
        hasErrors = false;
    }
}
