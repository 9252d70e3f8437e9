package ai.repld.repl;

import java.time.Instant;

/** Daemon-side session record: the handle given to clients plus the state it fronts. */
public final class ReplStateFacadeServer implements ReplStateFacade {
    private final int id;
    private final ReplStageState state;
    private final int port;
    private final Instant createdAt;
    private volatile Instant lastActiveAt;

    public ReplStateFacadeServer(int id, ReplStageState state, int port) {
        this.id = id;
        this.state = state;
        this.port = port;
        this.createdAt = Instant.now();
        this.lastActiveAt = createdAt;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public int getPort() {
        return port;
    }

    public ReplStageState getState() {
        return state;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActiveAt() {
        return lastActiveAt;
    }

    /** Marks the session as used now, deferring idle eviction. */
    public void touch() {
        lastActiveAt = Instant.now();
    }

    @Override
    public String toString() {
        return "ReplStateFacadeServer[id=" + id + ", port=" + port + ", generation=" + state.getCurrentGeneration()
                + "]";
    }
}
