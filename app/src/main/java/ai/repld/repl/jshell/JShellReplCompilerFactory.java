package ai.repld.repl.jshell;

import ai.repld.repl.ReplCompiler;
import ai.repld.repl.ReplCompilerConfiguration;
import ai.repld.repl.ReplCompilerFactory;
import java.nio.file.Path;
import java.util.List;

/** Registers {@link JShellReplCompiler} with the daemon. */
public final class JShellReplCompilerFactory implements ReplCompilerFactory {

    @Override
    public String name() {
        return "jshell";
    }

    @Override
    public ReplCompiler makeReplCompiler(
            String templateClassName,
            List<Path> templateClasspath,
            ClassLoader baseClassLoader,
            ReplCompilerConfiguration configuration) {
        return new JShellReplCompiler(templateClassName, templateClasspath, baseClassLoader, configuration);
    }
}
