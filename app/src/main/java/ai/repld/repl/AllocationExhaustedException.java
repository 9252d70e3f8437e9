package ai.repld.repl;

/**
 * Thrown when {@link IdAllocator} cannot find a free id within its retry budget. With a correct uniqueness check
 * this cannot happen, so it signals a bug rather than resource exhaustion.
 */
public final class AllocationExhaustedException extends IllegalStateException {
    public AllocationExhaustedException(String message) {
        super(message);
    }
}
