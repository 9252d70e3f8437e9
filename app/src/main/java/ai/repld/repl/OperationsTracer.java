package ai.repld.repl;

/** Instrumentation hooks bracketing every check/compile call. {@link #after} runs even if the call throws. */
public interface OperationsTracer {

    void before(String operation);

    void after(String operation);
}
