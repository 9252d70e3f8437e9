package ai.repld.repl;

import java.nio.file.Path;
import java.util.List;

/**
 * Settings handed to a {@link ReplCompilerFactory}.
 *
 * @param moduleName name used for generated code
 * @param classpath compiler and template classpath roots, in lookup order
 * @param messageCollector sink for diagnostics produced by the engine
 */
public record ReplCompilerConfiguration(String moduleName, List<Path> classpath, MessageCollector messageCollector) {
    public static final String DEFAULT_MODULE_NAME = "repl-script";

    public ReplCompilerConfiguration {
        classpath = List.copyOf(classpath);
    }
}
