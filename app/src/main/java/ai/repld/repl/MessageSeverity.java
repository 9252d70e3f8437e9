package ai.repld.repl;

/** Severity of a diagnostic reported by a REPL compiler. */
public enum MessageSeverity {
    EXCEPTION,
    ERROR,
    STRONG_WARNING,
    WARNING,
    INFO,
    LOGGING,
    OUTPUT;

    public boolean isError() {
        return this == EXCEPTION || this == ERROR;
    }

    public boolean isWarning() {
        return this == STRONG_WARNING || this == WARNING;
    }

    /** Verbose-only severities are hidden by printing collectors unless verbose output is enabled. */
    public boolean isVerboseOnly() {
        return this == LOGGING || this == OUTPUT;
    }

    public String presentableName() {
        return switch (this) {
            case EXCEPTION -> "exception";
            case ERROR -> "error";
            case STRONG_WARNING, WARNING -> "warning";
            case INFO -> "info";
            case LOGGING -> "logging";
            case OUTPUT -> "output";
        };
    }
}
