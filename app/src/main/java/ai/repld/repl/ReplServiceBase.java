package ai.repld.repl;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.jetbrains.annotations.Nullable;

/**
 * Forwards check/compile to the configured engine, bracketing each call with {@link #before}/{@link #after}.
 * Without an engine every call degrades to an "Initialization error" result.
 */
public abstract class ReplServiceBase implements ReplCompiler {
    public static final String INITIALIZATION_ERROR = "Initialization error";

    @Nullable
    protected final ReplCompiler replCompiler;

    protected ReplServiceBase(@Nullable ReplCompiler replCompiler) {
        this.replCompiler = replCompiler;
    }

    public boolean isInitialized() {
        return replCompiler != null;
    }

    @Override
    public ReplStageState createState(ReentrantReadWriteLock lock) {
        if (replCompiler == null) {
            throw new IllegalStateException("repl compiler is not initialized properly");
        }
        return replCompiler.createState(lock);
    }

    protected void before(String operation) {}

    protected void after(String operation) {}

    @Override
    public ReplCheckResult check(ReplStageState state, ReplCodeLine codeLine) {
        before("check");
        try {
            return replCompiler == null
                    ? new ReplCheckResult.Error(INITIALIZATION_ERROR)
                    : replCompiler.check(state, codeLine);
        } finally {
            after("check");
        }
    }

    @Override
    public ReplCompileResult compile(ReplStageState state, ReplCodeLine codeLine) {
        before("compile");
        try {
            return replCompiler == null
                    ? new ReplCompileResult.Error(INITIALIZATION_ERROR)
                    : replCompiler.compile(state, codeLine);
        } finally {
            after("compile");
        }
    }
}
