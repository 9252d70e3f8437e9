package ai.repld.repl;

import org.jetbrains.annotations.Nullable;

/**
 * The earliest error-severity diagnostic observed by a {@link KeepFirstErrorMessageCollector}.
 *
 * @param message the diagnostic text
 * @param location where the error was reported, if known
 */
public record FirstErrorRecord(String message, @Nullable MessageLocation location) {}
