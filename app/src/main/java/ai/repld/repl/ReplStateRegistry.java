package ai.repld.repl;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Live REPL sessions keyed by id.
 *
 * <p>Membership is guarded by one read/write lock: lookups run under the read lock, so calls against different
 * sessions proceed in parallel, while create and remove take the write lock. The registry does not serialize calls
 * against the same session; see {@link ReplStageState}.
 *
 * <p>Sessions live until {@link #remove(int)} is called, normally by the transport layer once a client has dropped
 * its handle, or until they are evicted as idle.
 */
public final class ReplStateRegistry {
    private static final Logger logger = LogManager.getLogger(ReplStateRegistry.class);

    private final ReentrantReadWriteLock statesLock = new ReentrantReadWriteLock();
    private final Map<Integer, ReplStateFacadeServer> states = new HashMap<>();
    private final IdAllocator idAllocator;

    /**
     * Create an empty registry with a randomly seeded id allocator.
     */
    public ReplStateRegistry() {
        this(new IdAllocator());
    }

    /**
     * Create an empty registry.
     *
     * @param idAllocator source of session ids
     */
    public ReplStateRegistry(IdAllocator idAllocator) {
        this.idAllocator = idAllocator;
    }

    /**
     * Register a new session. The id check and the insert happen under one write lock so concurrent creations
     * never pick the same id.
     *
     * @param port port the session handle is exported on
     * @param stateFactory creates the session state from a fresh per-session lock
     * @return the registered session
     * @throws AllocationExhaustedException if no free id could be found
     */
    public ReplStateFacadeServer create(int port, Function<ReentrantReadWriteLock, ReplStageState> stateFactory) {
        var wl = statesLock.writeLock();
        wl.lock();
        try {
            int id = idAllocator.nextId(candidate -> !states.containsKey(candidate));
            var facade = new ReplStateFacadeServer(id, stateFactory.apply(new ReentrantReadWriteLock()), port);
            states.put(id, facade);
            logger.debug("Created REPL state {} (live sessions: {})", id, states.size());
            return facade;
        } finally {
            wl.unlock();
        }
    }

    /**
     * Run {@code body} against the state of session {@code stateId}, marking the session as active.
     *
     * @param stateId the session id
     * @param body the work to run; it executes under the registry's read lock
     * @param <R> the body's result type
     * @return {@link CallResult.Good} with the body's value, or {@link CallResult.Error} if there is no such session
     */
    public <R> CallResult<R> withState(int stateId, Function<ReplStageState, R> body) {
        var rl = statesLock.readLock();
        rl.lock();
        try {
            var facade = states.get(stateId);
            if (facade == null) {
                return new CallResult.Error<>("No REPL state with id " + stateId + " found");
            }
            facade.touch();
            return new CallResult.Good<>(body.apply(facade.getState()));
        } finally {
            rl.unlock();
        }
    }

    /**
     * Look up a session without touching it.
     *
     * @param stateId the session id
     * @return the session, or empty if not registered
     */
    public Optional<ReplStateFacadeServer> find(int stateId) {
        var rl = statesLock.readLock();
        rl.lock();
        try {
            return Optional.ofNullable(states.get(stateId));
        } finally {
            rl.unlock();
        }
    }

    /**
     * Get the ids of all live sessions.
     *
     * @return a snapshot of the registered ids, in no particular order
     */
    public List<Integer> ids() {
        var rl = statesLock.readLock();
        rl.lock();
        try {
            return List.copyOf(states.keySet());
        } finally {
            rl.unlock();
        }
    }

    /**
     * Get the count of live sessions.
     *
     * @return the number of registered sessions
     */
    public int size() {
        var rl = statesLock.readLock();
        rl.lock();
        try {
            return states.size();
        } finally {
            rl.unlock();
        }
    }

    /**
     * Remove a session and dispose its state.
     *
     * @param stateId the session id
     * @return true if the session existed, false if it was already gone
     */
    public boolean remove(int stateId) {
        ReplStateFacadeServer removed;
        var wl = statesLock.writeLock();
        wl.lock();
        try {
            removed = states.remove(stateId);
        } finally {
            wl.unlock();
        }
        if (removed == null) {
            logger.debug("No REPL state {} to remove", stateId);
            return false;
        }
        dispose(removed);
        logger.debug("Removed REPL state {}", stateId);
        return true;
    }

    /**
     * Called by the transport layer when the client side of {@code handle} is gone.
     *
     * @param handle the handle the client held
     * @return true if the session existed
     */
    public boolean release(ReplStateFacade handle) {
        return remove(handle.getId());
    }

    /**
     * Remove sessions that have not been used for longer than {@code maxIdle}.
     *
     * @param maxIdle the idle time after which a session is evicted
     * @return the number of sessions evicted
     */
    public int evictIdle(Duration maxIdle) {
        var threshold = Instant.now().minus(maxIdle);
        var evicted = new ArrayList<ReplStateFacadeServer>();
        var wl = statesLock.writeLock();
        wl.lock();
        try {
            var it = states.values().iterator();
            while (it.hasNext()) {
                var facade = it.next();
                if (threshold.isAfter(facade.getLastActiveAt())) {
                    it.remove();
                    evicted.add(facade);
                }
            }
        } finally {
            wl.unlock();
        }
        for (var facade : evicted) {
            logger.info("Evicting idle REPL state {} (lastActiveAt={})", facade.getId(), facade.getLastActiveAt());
            dispose(facade);
        }
        return evicted.size();
    }

    /** Remove and dispose every session. */
    public void clear() {
        List<ReplStateFacadeServer> all;
        var wl = statesLock.writeLock();
        wl.lock();
        try {
            all = List.copyOf(states.values());
            states.clear();
        } finally {
            wl.unlock();
        }
        logger.info("Disposing all REPL states (count={})", all.size());
        all.forEach(ReplStateRegistry::dispose);
    }

    private static void dispose(ReplStateFacadeServer facade) {
        try {
            facade.getState().dispose();
        } catch (RuntimeException e) {
            logger.warn("Failed to dispose REPL state {}", facade.getId(), e);
        }
    }
}
