package ai.repld.repl.jshell;

import ai.repld.repl.BasicReplStageState;
import ai.repld.repl.ReplCodeLine;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import jdk.jshell.JShell;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** A session backed by its own {@link JShell} instance. */
final class JShellReplState extends BasicReplStageState {
    private static final Logger logger = LogManager.getLogger(JShellReplState.class);

    private final JShell shell;

    JShellReplState(ReentrantReadWriteLock lock, JShell shell) {
        super(lock);
        this.shell = shell;
    }

    JShell shell() {
        return shell;
    }

    int record(ReplCodeLine line) {
        return append(line);
    }

    @Override
    public void dispose() {
        var wl = getLock().writeLock();
        wl.lock();
        try {
            shell.close();
        } finally {
            wl.unlock();
        }
        logger.debug("Closed JShell after {} compiled lines", getCurrentGeneration());
    }
}
