package ai.repld.repl;

import java.util.ArrayDeque;
import java.util.Deque;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Logs the duration of each traced operation at debug level. */
public final class LoggingOperationsTracer implements OperationsTracer {
    private static final Logger logger = LogManager.getLogger(LoggingOperationsTracer.class);

    private final ThreadLocal<Deque<Long>> startTimes = ThreadLocal.withInitial(ArrayDeque::new);

    @Override
    public void before(String operation) {
        startTimes.get().push(System.nanoTime());
        logger.debug("{} started on {}", operation, Thread.currentThread().getName());
    }

    @Override
    public void after(String operation) {
        var stack = startTimes.get();
        var start = stack.poll();
        if (stack.isEmpty()) {
            startTimes.remove();
        }
        if (start == null) {
            logger.warn("{} finished without a matching start", operation);
            return;
        }
        logger.debug("{} finished in {} ms", operation, (System.nanoTime() - start) / 1_000_000);
    }
}
