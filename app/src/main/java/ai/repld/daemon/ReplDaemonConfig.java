package ai.repld.daemon;

import com.google.common.base.Splitter;
import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * Daemon settings, read from {@code --key value} / {@code --key=value} arguments with environment variables as the
 * fallback.
 *
 * @param host interface to listen on
 * @param port port to listen on; 0 picks a free port
 * @param templateClassName class statically imported into every session, or empty
 * @param templateClasspath classpath holding the template class
 * @param idleTimeout sessions unused for this long are evicted; {@link Duration#ZERO} disables eviction
 * @param evictionInterval how often idle sessions are looked for
 * @param trace whether check/compile calls are timed in the log
 * @param httpThreads worker threads of the HTTP server
 */
public record ReplDaemonConfig(
        String host,
        int port,
        String templateClassName,
        List<Path> templateClasspath,
        Duration idleTimeout,
        Duration evictionInterval,
        boolean trace,
        int httpThreads) {

    static final Set<String> VALID_ARGS = Set.of(
            "listen-addr",
            "template-class",
            "template-classpath",
            "idle-timeout-seconds",
            "eviction-interval-seconds",
            "http-threads",
            "trace",
            "help");

    static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(15);
    static final Duration DEFAULT_EVICTION_INTERVAL = Duration.ofSeconds(60);
    static final int DEFAULT_HTTP_THREADS = 8;

    public ReplDaemonConfig {
        templateClasspath = List.copyOf(templateClasspath);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (httpThreads < 1) {
            throw new IllegalArgumentException("http-threads must be at least 1, got: " + httpThreads);
        }
    }

    public boolean idleEvictionEnabled() {
        return !idleTimeout.isZero();
    }

    /** Result of parsing command-line arguments, including unrecognized keys. */
    public record ParseArgsResult(Map<String, String> args, Set<String> invalidKeys) {
        public boolean helpRequested() {
            return args.containsKey("help");
        }
    }

    /*
     * Supports both --key value and --key=value forms. Unknown keys are collected rather than rejected so the
     * caller can report all of them at once.
     */
    public static ParseArgsResult parseArgs(String[] args) {
        var result = new HashMap<String, String>();
        var invalidKeys = new HashSet<String>();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            if (!arg.startsWith("--")) {
                continue;
            }
            var withoutPrefix = arg.substring(2);
            String key;
            String value;
            if (withoutPrefix.contains("=")) {
                var parts = withoutPrefix.split("=", 2);
                key = parts[0];
                value = parts.length > 1 ? parts[1] : "";
            } else {
                key = withoutPrefix;
                if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                    value = args[++i];
                } else {
                    value = "";
                }
            }
            if (VALID_ARGS.contains(key)) {
                result.put(key, value);
            } else {
                invalidKeys.add(key);
            }
        }
        return new ParseArgsResult(result, invalidKeys);
    }

    public static ReplDaemonConfig fromArgs(Map<String, String> parsedArgs) {
        return fromArgs(parsedArgs, System::getenv);
    }

    /**
     * @param env environment lookup, injectable for tests
     * @throws IllegalArgumentException if a required value is missing or a value is malformed
     */
    public static ReplDaemonConfig fromArgs(Map<String, String> parsedArgs, Function<String, String> env) {
        var listenAddr = getConfigValue(parsedArgs, env, "listen-addr", "LISTEN_ADDR");
        if (listenAddr == null || listenAddr.isBlank()) {
            throw new IllegalArgumentException(
                    "LISTEN_ADDR must be provided via --listen-addr argument or LISTEN_ADDR environment variable");
        }
        var parts = Splitter.on(':').splitToList(listenAddr);
        if (parts.size() != 2) {
            throw new IllegalArgumentException("LISTEN_ADDR must be in format host:port, got: " + listenAddr);
        }
        int port;
        try {
            port = Integer.parseInt(parts.get(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in LISTEN_ADDR: " + parts.get(1), e);
        }

        var templateClass = getConfigValue(parsedArgs, env, "template-class", "REPL_TEMPLATE_CLASS");
        var templateClasspathStr = getConfigValue(parsedArgs, env, "template-classpath", "REPL_TEMPLATE_CLASSPATH");
        List<Path> templateClasspath = templateClasspathStr == null
                ? List.of()
                : Splitter.on(File.pathSeparatorChar).trimResults().omitEmptyStrings()
                        .splitToStream(templateClasspathStr)
                        .map(Path::of)
                        .toList();

        var idleTimeout = parseSeconds(
                getConfigValue(parsedArgs, env, "idle-timeout-seconds", "REPL_IDLE_TIMEOUT_SECONDS"),
                "REPL_IDLE_TIMEOUT_SECONDS",
                DEFAULT_IDLE_TIMEOUT);
        var evictionInterval = parseSeconds(
                getConfigValue(parsedArgs, env, "eviction-interval-seconds", "REPL_EVICTION_INTERVAL_SECONDS"),
                "REPL_EVICTION_INTERVAL_SECONDS",
                DEFAULT_EVICTION_INTERVAL);
        if (evictionInterval.isZero()) {
            throw new IllegalArgumentException("REPL_EVICTION_INTERVAL_SECONDS must be positive");
        }

        var httpThreadsStr = getConfigValue(parsedArgs, env, "http-threads", "REPL_HTTP_THREADS");
        int httpThreads = DEFAULT_HTTP_THREADS;
        if (httpThreadsStr != null && !httpThreadsStr.isBlank()) {
            try {
                httpThreads = Integer.parseInt(httpThreadsStr.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid REPL_HTTP_THREADS: " + httpThreadsStr, e);
            }
        }

        // a bare --trace means true
        var traceStr = parsedArgs.containsKey("trace") ? parsedArgs.get("trace") : env.apply("REPL_TRACE");
        boolean trace = traceStr != null && (traceStr.isBlank() || Boolean.parseBoolean(traceStr.strip()));

        return new ReplDaemonConfig(
                parts.get(0),
                port,
                templateClass == null ? "" : templateClass.strip(),
                templateClasspath,
                idleTimeout,
                evictionInterval,
                trace,
                httpThreads);
    }

    @Nullable
    private static String getConfigValue(
            Map<String, String> parsedArgs, Function<String, String> env, String argKey, String envVarName) {
        var argValue = parsedArgs.get(argKey);
        if (argValue != null && !argValue.isBlank()) {
            return argValue;
        }
        return env.apply(envVarName);
    }

    private static Duration parseSeconds(@Nullable String value, String name, Duration defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        long secs;
        try {
            secs = Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
        if (secs < 0) {
            throw new IllegalArgumentException(name + " must not be negative, got: " + secs);
        }
        return Duration.ofSeconds(secs);
    }
}
