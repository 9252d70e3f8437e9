package ai.repld.repl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Sends compiler diagnostics to the daemon log. */
public final class LoggingMessageCollector implements MessageCollector {
    private static final Logger logger = LogManager.getLogger(LoggingMessageCollector.class);

    private volatile boolean hasErrors = false;

    @Override
    public void report(MessageSeverity severity, String message, @Nullable MessageLocation location) {
        var where = location == null ? "" : location + ": ";
        if (severity.isError()) {
            hasErrors = true;
            logger.error("{}{}", where, message);
        } else if (severity.isWarning()) {
            logger.warn("{}{}", where, message);
        } else {
            logger.debug("[{}] {}{}", severity.presentableName(), where, message);
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
