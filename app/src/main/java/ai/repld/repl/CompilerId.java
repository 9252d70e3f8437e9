package ai.repld.repl;

import java.nio.file.Path;
import java.util.List;

/**
 * Identifies the compiler installation a daemon was started for.
 *
 * @param compilerClasspath jars making up the compiler; searched for engine plugins when not already visible
 * @param compilerVersion version string reported to clients
 */
public record CompilerId(List<Path> compilerClasspath, String compilerVersion) {
    public CompilerId {
        compilerClasspath = List.copyOf(compilerClasspath);
    }

    public static CompilerId current() {
        var version = Runtime.version().toString();
        return new CompilerId(List.of(), version);
    }
}
