package ai.repld.repl;

/** Client-visible handle of a REPL session. The transport layer routes calls by {@link #getId()}. */
public interface ReplStateFacade {

    int getId();

    /** Port the handle was exported on, or 0 if it is not exported. */
    int getPort();
}
