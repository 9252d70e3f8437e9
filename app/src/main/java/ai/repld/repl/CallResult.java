package ai.repld.repl;

/** Result of an operation addressed to a session id: either the body's value or a reason it was not run. */
public sealed interface CallResult<R> {

    boolean isGood();

    /**
     * @throws IllegalStateException if this is an {@link Error}
     */
    R get();

    record Good<R>(R result) implements CallResult<R> {
        @Override
        public boolean isGood() {
            return true;
        }

        @Override
        public R get() {
            return result;
        }
    }

    record Error<R>(String message) implements CallResult<R> {
        @Override
        public boolean isGood() {
            return false;
        }

        @Override
        public R get() {
            throw new IllegalStateException(message);
        }
    }
}
