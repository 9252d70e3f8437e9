package ai.repld.repl;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/** History bookkeeping shared by engine-specific states. Mutators must be called under the write lock. */
public abstract class BasicReplStageState implements ReplStageState {
    private final ReentrantReadWriteLock lock;
    private final List<ReplCodeLine> history = new ArrayList<>();

    protected BasicReplStageState(ReentrantReadWriteLock lock) {
        this.lock = lock;
    }

    @Override
    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    @Override
    public List<ReplCodeLine> getHistory() {
        var rl = lock.readLock();
        rl.lock();
        try {
            return List.copyOf(history);
        } finally {
            rl.unlock();
        }
    }

    @Override
    public int getCurrentGeneration() {
        var rl = lock.readLock();
        rl.lock();
        try {
            return history.size();
        } finally {
            rl.unlock();
        }
    }

    /** Records a successfully compiled line and returns the new generation. */
    protected int append(ReplCodeLine line) {
        assert lock.isWriteLockedByCurrentThread();
        history.add(line);
        return history.size();
    }
}
