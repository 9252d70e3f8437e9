package ai.repld.daemon;

import ai.repld.repl.ReplService;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Periodically removes REPL sessions that have not been used for a while. */
public final class IdleSessionEvictor implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(IdleSessionEvictor.class);

    private final ReplService service;
    private final Duration idleTimeout;
    private final Duration evictionInterval;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        var t = new Thread(r, "repld-IdleEvictor");
        t.setDaemon(true);
        return t;
    });

    public IdleSessionEvictor(ReplService service, Duration idleTimeout, Duration evictionInterval) {
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("idleTimeout must be positive, got: " + idleTimeout);
        }
        if (evictionInterval.isNegative() || evictionInterval.isZero()) {
            throw new IllegalArgumentException("evictionInterval must be positive, got: " + evictionInterval);
        }
        this.service = service;
        this.idleTimeout = idleTimeout;
        this.evictionInterval = evictionInterval;
    }

    public void start() {
        scheduler.scheduleAtFixedRate(
                this::runOnce, evictionInterval.toMillis(), evictionInterval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Idle session eviction every {} for sessions idle longer than {}", evictionInterval, idleTimeout);
    }

    /** One eviction pass; returns the number of sessions removed. */
    int runOnce() {
        try {
            var evicted = service.evictIdle(idleTimeout);
            if (evicted > 0) {
                logger.info("Idle eviction cycle evicted {} session(s)", evicted);
            }
            return evicted;
        } catch (RuntimeException e) {
            logger.warn("Error during idle eviction cycle", e);
            return 0;
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
