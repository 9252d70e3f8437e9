package ai.repld.repl;

import java.nio.file.Path;
import java.util.List;

/**
 * Plugin entry point for REPL engines, discovered through {@link java.util.ServiceLoader}. Exactly one factory
 * must be visible to the daemon.
 */
public interface ReplCompilerFactory {

    /** Short name used in diagnostics when several factories are found. */
    String name();

    /**
     * @param templateClassName class whose members every session sees, or empty for none
     * @param templateClasspath classpath that holds the template and its dependencies
     * @param baseClassLoader loader the engine should parent any class loading on
     * @param configuration compiler settings
     */
    ReplCompiler makeReplCompiler(
            String templateClassName,
            List<Path> templateClasspath,
            ClassLoader baseClassLoader,
            ReplCompilerConfiguration configuration);
}
