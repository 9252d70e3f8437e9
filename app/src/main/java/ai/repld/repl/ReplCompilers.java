package ai.repld.repl;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Builds the daemon's single {@link ReplCompiler} from the engine plugins on the classpath. */
public final class ReplCompilers {
    private static final Logger logger = LogManager.getLogger(ReplCompilers.class);

    private ReplCompilers() {}

    /**
     * Discover exactly one {@link ReplCompilerFactory} and build a compiler from it.
     *
     * @throws ReplInitializationException if zero or several engines are found, or construction fails
     */
    public static ReplCompiler makeReplCompiler(
            CompilerId compilerId,
            List<Path> templateClasspath,
            String templateClassName,
            MessageCollector messageCollector) {
        List<ReplCompilerFactory> factories;
        try {
            factories = discoverFactories(compilerId);
        } catch (ServiceConfigurationError | NoClassDefFoundError e) {
            messageCollector.report(MessageSeverity.ERROR, "Unable to construct repl compiler: " + e.getMessage());
            throw new ReplInitializationException(
                    ReplInitializationException.Reason.NOT_FOUND,
                    "Unable to use scripting/REPL in the daemon, no REPL engine or its dependencies are found in"
                            + " the compiler classpath",
                    e);
        }
        return makeReplCompiler(compilerId, templateClasspath, templateClassName, messageCollector, factories);
    }

    /** Same as {@link #makeReplCompiler(CompilerId, List, String, MessageCollector)} with explicit candidates. */
    public static ReplCompiler makeReplCompiler(
            CompilerId compilerId,
            List<Path> templateClasspath,
            String templateClassName,
            MessageCollector messageCollector,
            List<? extends ReplCompilerFactory> factories) {
        var classpath = new ArrayList<Path>(compilerId.compilerClasspath());
        classpath.addAll(templateClasspath);
        var configuration = new ReplCompilerConfiguration(
                ReplCompilerConfiguration.DEFAULT_MODULE_NAME, classpath, messageCollector);

        try {
            if (factories.isEmpty()) {
                throw new ReplInitializationException(
                        ReplInitializationException.Reason.NOT_FOUND, "no scripting plugin loaded");
            }
            if (factories.size() > 1) {
                var names = factories.stream().map(ReplCompilerFactory::name).collect(Collectors.joining(", "));
                throw new ReplInitializationException(
                        ReplInitializationException.Reason.AMBIGUOUS, "several scripting plugins loaded: " + names);
            }

            var factory = factories.get(0);
            logger.info(
                    "Creating REPL compiler with engine {} (compiler {}, template '{}')",
                    factory.name(),
                    compilerId.compilerVersion(),
                    templateClassName);
            return factory.makeReplCompiler(
                    templateClassName, templateClasspath, ReplCompilers.class.getClassLoader(), configuration);
        } catch (Throwable ex) {
            messageCollector.report(MessageSeverity.ERROR, "Unable to construct repl compiler: " + ex.getMessage());
            var reason = ex instanceof ReplInitializationException rie
                    ? rie.getReason()
                    : ReplInitializationException.Reason.FAILED;
            throw new ReplInitializationException(
                    reason, "Unable to use scripting/REPL in the daemon: " + ex.getMessage(), ex);
        }
    }

    private static List<ReplCompilerFactory> discoverFactories(CompilerId compilerId) {
        var found = new ArrayList<ReplCompilerFactory>();
        ServiceLoader.load(ReplCompilerFactory.class, ReplCompilers.class.getClassLoader())
                .forEach(found::add);
        if (!found.isEmpty() || compilerId.compilerClasspath().isEmpty()) {
            return found;
        }

        // Not on our own classpath; look in the compiler's jars.
        var urls = compilerId.compilerClasspath().stream()
                .map(ReplCompilers::toUrl)
                .toArray(URL[]::new);
        var loader = new URLClassLoader(urls, ReplCompilers.class.getClassLoader());
        ServiceLoader.load(ReplCompilerFactory.class, loader).forEach(found::add);
        if (found.isEmpty()) {
            try {
                loader.close();
            } catch (IOException e) {
                logger.debug("Failed to close plugin class loader", e);
            }
        }
        return found;
    }

    private static URL toUrl(Path path) {
        try {
            return path.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Invalid compiler classpath entry: " + path, e);
        }
    }
}
