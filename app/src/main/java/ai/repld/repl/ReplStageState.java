package ai.repld.repl;

import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Accumulated state of one REPL session: the lines compiled so far plus whatever symbol environment the engine
 * keeps. Each instance belongs to exactly one session.
 *
 * <p>{@link ReplStateRegistry} does not serialize calls against the same state. Engines that cannot tolerate
 * concurrent use of one state must serialize on {@link #getLock()}; the bundled JShell engine does.
 */
public interface ReplStageState {

    /** The lock this state was created with. */
    ReentrantReadWriteLock getLock();

    /** Lines successfully compiled into this state, oldest first. */
    List<ReplCodeLine> getHistory();

    /** Incremented on every successful compile; 0 for a fresh state. */
    int getCurrentGeneration();

    /** Releases engine resources. Called once when the owning session is removed. */
    default void dispose() {}
}
