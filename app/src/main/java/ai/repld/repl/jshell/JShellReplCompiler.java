package ai.repld.repl.jshell;

import ai.repld.repl.KeepFirstErrorMessageCollector;
import ai.repld.repl.MessageLocation;
import ai.repld.repl.MessageSeverity;
import ai.repld.repl.ReplCheckResult;
import ai.repld.repl.ReplCodeLine;
import ai.repld.repl.ReplCompileResult;
import ai.repld.repl.ReplCompiler;
import ai.repld.repl.ReplCompilerConfiguration;
import ai.repld.repl.ReplStageState;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import jdk.jshell.DeclarationSnippet;
import jdk.jshell.Diag;
import jdk.jshell.EvalException;
import jdk.jshell.JShell;
import jdk.jshell.PersistentSnippet;
import jdk.jshell.Snippet;
import jdk.jshell.SnippetEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * REPL engine built on {@code jdk.jshell}. Each session owns a JShell instance running snippets in the daemon JVM.
 *
 * <p>Calls against one state are serialized on that state's write lock, since JShell instances are not
 * thread-safe. A line must hold exactly one snippet.
 */
public final class JShellReplCompiler implements ReplCompiler {
    private static final Logger logger = LogManager.getLogger(JShellReplCompiler.class);

    static final String EXECUTION_ENGINE = "local";
    static final String EMPTY_LINE = "Empty code line";
    static final String SEVERAL_SNIPPETS = "Only one declaration or statement per line is supported";

    private final String templateClassName;
    private final List<Path> templateClasspath;
    private final ReplCompilerConfiguration configuration;

    public JShellReplCompiler(
            String templateClassName,
            List<Path> templateClasspath,
            ClassLoader baseClassLoader,
            ReplCompilerConfiguration configuration) {
        this.templateClassName = templateClassName.strip();
        this.templateClasspath = List.copyOf(templateClasspath);
        this.configuration = configuration;
        if (!this.templateClassName.isEmpty()) {
            verifyTemplate(baseClassLoader);
        }
    }

    private void verifyTemplate(ClassLoader baseClassLoader) {
        var urls = templateClasspath.stream().map(JShellReplCompiler::toUrl).toArray(URL[]::new);
        try (var loader = new URLClassLoader(urls, baseClassLoader)) {
            Class.forName(templateClassName, false, loader);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException(
                    "Template class " + templateClassName + " not found on " + templateClasspath, e);
        } catch (IOException e) {
            logger.debug("Failed to close template class loader", e);
        }
    }

    @Override
    public ReplStageState createState(ReentrantReadWriteLock lock) {
        var shell = JShell.builder().executionEngine(EXECUTION_ENGINE).build();
        try {
            for (var path : configuration.classpath()) {
                shell.addToClasspath(path.toString());
            }
            if (!templateClassName.isEmpty()) {
                var events = shell.eval("import static " + templateClassName + ".*;");
                if (events.stream().anyMatch(e -> e.status() == Snippet.Status.REJECTED)) {
                    throw new IllegalStateException("Unable to import template class " + templateClassName);
                }
            }
        } catch (RuntimeException e) {
            shell.close();
            throw e;
        }
        return new JShellReplState(lock, shell);
    }

    @Override
    public ReplCheckResult check(ReplStageState state, ReplCodeLine codeLine) {
        var jshellState = asJShellState(state);
        var wl = jshellState.getLock().writeLock();
        wl.lock();
        try {
            var info = jshellState.shell().sourceCodeAnalysis().analyzeCompletion(codeLine.code());
            switch (info.completeness()) {
                case DEFINITELY_INCOMPLETE, CONSIDERED_INCOMPLETE -> {
                    return new ReplCheckResult.Incomplete();
                }
                case EMPTY -> {
                    return new ReplCheckResult.Error(EMPTY_LINE);
                }
                case UNKNOWN -> {
                    var collector = new KeepFirstErrorMessageCollector(configuration.messageCollector());
                    collector.report(
                            MessageSeverity.ERROR,
                            "Unable to parse: " + info.source().strip(),
                            MessageLocation.of(sourcePath(codeLine), codeLine.no(), -1));
                    return new ReplCheckResult.Error(requireMessage(collector), collector.firstErrorLocation());
                }
                default -> {}
            }
            // one snippet per line, as in compile
            if (!info.remaining().isBlank()) {
                return new ReplCheckResult.Error(SEVERAL_SNIPPETS);
            }
            return new ReplCheckResult.Ok();
        } finally {
            wl.unlock();
        }
    }

    @Override
    public ReplCompileResult compile(ReplStageState state, ReplCodeLine codeLine) {
        var jshellState = asJShellState(state);
        var wl = jshellState.getLock().writeLock();
        wl.lock();
        try {
            var shell = jshellState.shell();
            var info = shell.sourceCodeAnalysis().analyzeCompletion(codeLine.code());
            switch (info.completeness()) {
                case DEFINITELY_INCOMPLETE, CONSIDERED_INCOMPLETE -> {
                    return new ReplCompileResult.Incomplete();
                }
                case EMPTY -> {
                    return new ReplCompileResult.Error(EMPTY_LINE);
                }
                default -> {}
            }
            if (!info.remaining().isBlank()) {
                return new ReplCompileResult.Error(SEVERAL_SNIPPETS);
            }

            var collector = new KeepFirstErrorMessageCollector(configuration.messageCollector());
            var activeBefore = activePersistentSnippets(shell);
            var events = shell.eval(codeLine.code());
            var primary = events.stream().filter(e -> e.causeSnippet() == null).toList();
            if (primary.isEmpty()) {
                restoreOverwritten(shell, activeBefore);
                return new ReplCompileResult.Error("Nothing was compiled");
            }

            for (var event : primary) {
                switch (event.status()) {
                    case REJECTED -> reportDiagnostics(shell, event.snippet(), codeLine, collector);
                    case RECOVERABLE_NOT_DEFINED -> {
                        var unresolved = shell.unresolvedDependencies((DeclarationSnippet) event.snippet())
                                .toList();
                        collector.report(
                                MessageSeverity.ERROR,
                                "Cannot resolve " + String.join(", ", unresolved),
                                MessageLocation.of(sourcePath(codeLine), codeLine.no(), -1));
                    }
                    default -> {}
                }
            }
            if (collector.firstError().isPresent()) {
                dropDefined(shell, primary);
                restoreOverwritten(shell, activeBefore);
                return new ReplCompileResult.Error(requireMessage(collector), collector.firstErrorLocation());
            }

            var generation = jshellState.record(codeLine);
            return new ReplCompileResult.CompiledClasses(codeLine, generation, describe(primary));
        } finally {
            wl.unlock();
        }
    }

    private void reportDiagnostics(
            JShell shell, Snippet snippet, ReplCodeLine codeLine, KeepFirstErrorMessageCollector collector) {
        var diagnostics = shell.diagnostics(snippet).toList();
        if (diagnostics.isEmpty()) {
            collector.report(MessageSeverity.ERROR, "Rejected: " + snippet.source().strip());
            return;
        }
        for (var diag : diagnostics) {
            collector.report(
                    diag.isError() ? MessageSeverity.ERROR : MessageSeverity.WARNING,
                    diag.getMessage(Locale.ROOT),
                    locate(diag, snippet.source(), codeLine));
        }
    }

    private static void dropDefined(JShell shell, List<SnippetEvent> events) {
        for (var event : events) {
            if (event.snippet() instanceof PersistentSnippet persistent
                    && event.status() != Snippet.Status.REJECTED) {
                shell.drop(persistent);
            }
        }
    }

    private static List<PersistentSnippet> activePersistentSnippets(JShell shell) {
        return shell.snippets()
                .filter(snippet -> snippet instanceof PersistentSnippet)
                .filter(snippet -> shell.status(snippet).isActive())
                .map(snippet -> (PersistentSnippet) snippet)
                .toList();
    }

    /**
     * Re-evaluate declarations that a failed line replaced. A restored variable is initialized again from its
     * declaration.
     */
    private static void restoreOverwritten(JShell shell, List<PersistentSnippet> activeBefore) {
        for (var snippet : activeBefore) {
            if (shell.status(snippet) != Snippet.Status.OVERWRITTEN) {
                continue;
            }
            var restored = shell.eval(snippet.source());
            boolean ok = restored.stream()
                    .filter(e -> e.causeSnippet() == null)
                    .allMatch(e -> e.status().isActive());
            if (ok) {
                logger.debug("Restored {} {} after failed line", snippet.kind(), snippet.name());
            } else {
                logger.warn("Unable to restore {} {} after failed line", snippet.kind(), snippet.name());
            }
        }
    }

    private static CompiledSnippet describe(List<SnippetEvent> events) {
        var ids = new ArrayList<String>();
        String name = null;
        String value = null;
        String exception = null;
        var kind = events.get(0).snippet().kind().name();
        for (var event : events) {
            ids.add(event.snippet().id());
            if (name == null && event.snippet() instanceof PersistentSnippet persistent) {
                name = persistent.name();
            }
            if (value == null && event.value() != null) {
                value = event.value();
            }
            if (exception == null && event.exception() != null) {
                var thrown = event.exception();
                var type = thrown instanceof EvalException evalException
                        ? evalException.getExceptionClassName()
                        : thrown.getClass().getName();
                exception = thrown.getMessage() == null ? type : type + ": " + thrown.getMessage();
            }
        }
        return new CompiledSnippet(List.copyOf(ids), kind, name, value, exception);
    }

    private static MessageLocation locate(Diag diag, String source, ReplCodeLine codeLine) {
        long start = diag.getStartPosition();
        long end = diag.getEndPosition();
        if (start == Diag.NOPOS) {
            return MessageLocation.of(sourcePath(codeLine), codeLine.no(), -1);
        }
        int column = columnOf(source, (int) Math.min(start, source.length()));
        int columnEnd = end == Diag.NOPOS ? -1 : columnOf(source, (int) Math.min(end, source.length()));
        return new MessageLocation(
                sourcePath(codeLine), codeLine.no(), column, codeLine.no(), columnEnd, firstLine(source));
    }

    private static int columnOf(String source, int offset) {
        int lineStart = source.lastIndexOf('\n', Math.max(0, offset - 1)) + 1;
        return offset - lineStart + 1;
    }

    private static String firstLine(String source) {
        int newline = source.indexOf('\n');
        return newline < 0 ? source : source.substring(0, newline);
    }

    private static String sourcePath(ReplCodeLine codeLine) {
        return "line" + codeLine.no() + ".jsh";
    }

    private static String requireMessage(KeepFirstErrorMessageCollector collector) {
        var message = collector.firstErrorMessage();
        return message == null ? "Unknown error" : message;
    }

    private static JShellReplState asJShellState(ReplStageState state) {
        if (state instanceof JShellReplState jshellState) {
            return jshellState;
        }
        throw new IllegalArgumentException("State was not created by this compiler: " + state.getClass().getName());
    }

    private static URL toUrl(Path path) {
        try {
            return path.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Invalid template classpath entry: " + path, e);
        }
    }
}
