package ai.repld.repl;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Compatibility layer for clients that predate explicit sessions: every call goes to one implicit session that is
 * created on first use.
 *
 * @deprecated create a session with {@link ReplService#createRemoteState()} and pass its id instead
 */
@Deprecated
public final class DefaultStateReplService {
    private final ReplService service;

    @Nullable
    private ReplStateFacadeServer defaultStateFacade;

    public DefaultStateReplService(ReplService service) {
        this.service = service;
    }

    private synchronized ReplStateFacadeServer defaultStateFacade() {
        if (defaultStateFacade == null) {
            defaultStateFacade = service.createRemoteState();
        }
        return defaultStateFacade;
    }

    /** @deprecated use {@link ReplService#check(int, ReplCodeLine)} */
    @Deprecated
    public ReplCheckResult check(ReplCodeLine codeLine) {
        if (!service.isInitialized()) {
            return new ReplCheckResult.Error(ReplServiceBase.INITIALIZATION_ERROR);
        }
        return service.check(defaultStateFacade().getState(), codeLine);
    }

    /**
     * @param verifyHistory ignored; kept for source compatibility
     * @deprecated use {@link ReplService#compile(int, ReplCodeLine)}
     */
    @Deprecated
    public ReplCompileResult compile(ReplCodeLine codeLine, @Nullable List<ReplCodeLine> verifyHistory) {
        if (!service.isInitialized()) {
            return new ReplCompileResult.Error(ReplServiceBase.INITIALIZATION_ERROR);
        }
        return service.compile(defaultStateFacade().getState(), codeLine);
    }

    /** Id of the implicit session, creating it if needed. */
    public int defaultStateId() {
        return defaultStateFacade().getId();
    }
}
