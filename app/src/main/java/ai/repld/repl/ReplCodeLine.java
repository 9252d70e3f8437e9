package ai.repld.repl;

/**
 * One unit of REPL input.
 *
 * @param no sequence number assigned by the client
 * @param generation history generation the client believes it is extending
 * @param code the source text
 */
public record ReplCodeLine(int no, int generation, String code) {
    public static final int NO_GENERATION = -1;

    public ReplCodeLine {
        if (code == null) {
            throw new IllegalArgumentException("code must not be null");
        }
    }

    public static ReplCodeLine of(int no, String code) {
        return new ReplCodeLine(no, NO_GENERATION, code);
    }
}
