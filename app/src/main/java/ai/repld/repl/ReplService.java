package ai.repld.repl;

import java.time.Duration;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The daemon's REPL entry point: creates sessions, routes check/compile calls to them by id and removes them
 * when their clients go away.
 */
public class ReplService extends ReplServiceBase implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ReplService.class);

    private final int portForServers;

    @Nullable
    private final OperationsTracer operationsTracer;

    private final ReplStateRegistry states;

    /**
     * Create a service with its own empty registry.
     *
     * @param portForServers port reported by session handles created without an explicit port
     * @param replCompiler the engine, or null to run degraded
     * @param tracer timing hooks around check/compile, or null for none
     */
    public ReplService(int portForServers, @Nullable ReplCompiler replCompiler, @Nullable OperationsTracer tracer) {
        this(portForServers, replCompiler, tracer, new ReplStateRegistry());
    }

    /**
     * Create a service over an existing registry.
     *
     * @param portForServers port reported by session handles created without an explicit port
     * @param replCompiler the engine, or null to run degraded
     * @param tracer timing hooks around check/compile, or null for none
     * @param states the session registry
     */
    public ReplService(
            int portForServers,
            @Nullable ReplCompiler replCompiler,
            @Nullable OperationsTracer tracer,
            ReplStateRegistry states) {
        super(replCompiler);
        this.portForServers = portForServers;
        this.operationsTracer = tracer;
        this.states = states;
        if (replCompiler == null) {
            logger.warn("REPL service started without a compiler; all calls will report an initialization error");
        }
    }

    @Override
    protected void before(String operation) {
        if (operationsTracer != null) {
            operationsTracer.before(operation);
        }
    }

    @Override
    protected void after(String operation) {
        if (operationsTracer != null) {
            operationsTracer.after(operation);
        }
    }

    /**
     * Create a new session on the service's default port.
     *
     * @return the new session
     * @throws IllegalStateException if the compiler failed to initialize
     */
    public ReplStateFacadeServer createRemoteState() {
        return createRemoteState(portForServers);
    }

    /**
     * Create a new session exported on {@code port}.
     *
     * @param port port reported by the session handle
     * @return the new session
     * @throws IllegalStateException if the compiler failed to initialize
     * @throws AllocationExhaustedException if no session id could be allocated
     */
    public ReplStateFacadeServer createRemoteState(int port) {
        var facade = states.create(port, this::createState);
        logger.info("Created REPL session {}", facade.getId());
        return facade;
    }

    /**
     * Run {@code body} against a session's state.
     *
     * @param stateId the session id
     * @param body the work to run
     * @param <R> the body's result type
     * @return the body's result, or an error if there is no such session
     */
    public <R> CallResult<R> withValidReplState(int stateId, Function<ReplStageState, R> body) {
        return states.withState(stateId, body);
    }

    /**
     * Check a line against a session without advancing it. Engine exceptions are returned as an error result.
     *
     * @param stateId the session id
     * @param codeLine the line to check
     * @return the check result, or an error if there is no such session
     */
    public CallResult<ReplCheckResult> check(int stateId, ReplCodeLine codeLine) {
        return withValidReplState(stateId, state -> {
            try {
                return check(state, codeLine);
            } catch (RuntimeException e) {
                logger.error("check of line {} failed in REPL session {}", codeLine.no(), stateId, e);
                return new ReplCheckResult.Error(internalErrorMessage(e));
            }
        });
    }

    /**
     * Compile a line into a session. Engine exceptions are returned as an error result.
     *
     * @param stateId the session id
     * @param codeLine the line to compile
     * @return the compile result, or an error if there is no such session
     */
    public CallResult<ReplCompileResult> compile(int stateId, ReplCodeLine codeLine) {
        return withValidReplState(stateId, state -> {
            try {
                return compile(state, codeLine);
            } catch (RuntimeException e) {
                logger.error("compile of line {} failed in REPL session {}", codeLine.no(), stateId, e);
                return new ReplCompileResult.Error(internalErrorMessage(e));
            }
        });
    }

    /**
     * Drop the session whose client handle is gone.
     *
     * @param stateId the session id
     * @return true if the session existed
     */
    public boolean releaseRemoteState(int stateId) {
        var removed = states.remove(stateId);
        if (removed) {
            logger.info("Released REPL session {}", stateId);
        }
        return removed;
    }

    /**
     * Remove sessions idle for longer than {@code maxIdle}.
     *
     * @param maxIdle the idle time after which a session is evicted
     * @return the number of sessions evicted
     */
    public int evictIdle(Duration maxIdle) {
        return states.evictIdle(maxIdle);
    }

    public ReplStateRegistry getStates() {
        return states;
    }

    /**
     * Dispose every session.
     */
    @Override
    public void close() {
        states.clear();
    }

    private static String internalErrorMessage(RuntimeException e) {
        var message = e.getMessage();
        return "Internal error: " + (message == null ? e.getClass().getSimpleName() : message);
    }
}
