package ai.repld.repl;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/** An incremental compilation engine that checks and compiles one code line at a time against a session state. */
public interface ReplCompiler {

    ReplStageState createState(ReentrantReadWriteLock lock);

    default ReplStageState createState() {
        return createState(new ReentrantReadWriteLock());
    }

    /** Analyzes {@code codeLine} without advancing {@code state}. */
    ReplCheckResult check(ReplStageState state, ReplCodeLine codeLine);

    /** Compiles {@code codeLine}, advancing {@code state} on success and leaving it untouched otherwise. */
    ReplCompileResult compile(ReplStageState state, ReplCodeLine codeLine);
}
