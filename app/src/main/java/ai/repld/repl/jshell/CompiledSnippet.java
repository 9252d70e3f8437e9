package ai.repld.repl.jshell;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * What compiling one line produced.
 *
 * @param snippetIds JShell ids of the snippets created
 * @param kind snippet kind, e.g. {@code VAR} or {@code METHOD}
 * @param name declared name, absent for statements
 * @param value rendered value of an expression or variable initializer
 * @param exception message of an exception thrown while initializing, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompiledSnippet(
        List<String> snippetIds,
        String kind,
        @Nullable String name,
        @Nullable String value,
        @Nullable String exception) {}
