package ai.repld.repl;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntPredicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Hands out positive session ids that are not in use. */
public final class IdAllocator {
    private static final Logger logger = LogManager.getLogger(IdAllocator.class);

    static final int MAX_ATTEMPTS = 100;

    private final AtomicInteger counter;
    private final Random random;

    public IdAllocator() {
        this(0, new Random());
    }

    /**
     * @param lastId the counter value; the first candidate is {@code lastId + 1}
     * @param random source of the jumps taken after a collision
     */
    public IdAllocator(int lastId, Random random) {
        this.counter = new AtomicInteger(lastId);
        this.random = random;
    }

    /**
     * Return the next id accepted by {@code isFree}.
     *
     * @param isFree returns false for ids already in use
     * @throws AllocationExhaustedException if no acceptable id is found within {@value #MAX_ATTEMPTS} attempts
     */
    public int nextId(IntPredicate isFree) {
        // counter may have wrapped around
        int newId = counter.incrementAndGet();
        int attemptsLeft = MAX_ATTEMPTS;
        while (newId <= 0 || !isFree.test(newId)) {
            attemptsLeft -= 1;
            if (attemptsLeft <= 0) {
                logger.error("No free session id found after {} attempts (last candidate {})", MAX_ATTEMPTS, newId);
                throw new AllocationExhaustedException("Invalid state or algorithm error");
            }
            // jump away from the clash to avoid walking through a run of taken ids
            newId = counter.addAndGet(random.nextInt());
            logger.debug("Session id clash, retrying with {}", newId);
        }
        return newId;
    }

    /** The most recently produced candidate. */
    public int lastId() {
        return counter.get();
    }
}
