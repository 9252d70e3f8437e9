package ai.repld.daemon;

import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class ReplDaemonMain {
    private static final Logger logger = LogManager.getLogger(ReplDaemonMain.class);

    private ReplDaemonMain() {}

    /*
     * Print usage/help information and exit.
     * If invalidArgs is non-empty, prints an error message first and exits with code 1.
     */
    private static void printUsageAndExit(Set<String> invalidArgs) {
        if (!invalidArgs.isEmpty()) {
            System.err.println("Error: Unknown argument(s): "
                    + invalidArgs.stream().map(arg -> "--" + arg).collect(Collectors.joining(", ")));
            System.err.println();
        }

        System.out.println("Usage: java ai.repld.daemon.ReplDaemonMain [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --listen-addr <host:port>            Address to listen on (required)");
        System.out.println("  --template-class <name>              Class statically imported into every session");
        System.out.println("  --template-classpath <paths>         Classpath holding the template class");
        System.out.println("  --idle-timeout-seconds <n>           Evict sessions idle this long, 0 disables (900)");
        System.out.println("  --eviction-interval-seconds <n>      How often to look for idle sessions (60)");
        System.out.println("  --http-threads <n>                   HTTP worker threads (8)");
        System.out.println("  --trace                              Log timing of every check/compile call");
        System.out.println("  --help                               Show this help message");
        System.out.println();
        System.out.println("Arguments can also be provided via environment variables:");
        System.out.println("  LISTEN_ADDR, REPL_TEMPLATE_CLASS, REPL_TEMPLATE_CLASSPATH, REPL_IDLE_TIMEOUT_SECONDS,");
        System.out.println("  REPL_EVICTION_INTERVAL_SECONDS, REPL_HTTP_THREADS, REPL_TRACE");
        System.out.println();

        System.exit(invalidArgs.isEmpty() ? 0 : 1);
    }

    public static void main(String[] args) {
        try {
            var parsed = ReplDaemonConfig.parseArgs(args);
            if (!parsed.invalidKeys().isEmpty() || parsed.helpRequested()) {
                printUsageAndExit(parsed.invalidKeys());
                return;
            }
            logger.debug("Parsed arguments: {}", parsed.args());

            var config = ReplDaemonConfig.fromArgs(parsed.args());
            var daemon = new ReplDaemon(config);
            daemon.start();

            Runtime.getRuntime()
                    .addShutdownHook(new Thread(
                            () -> {
                                logger.info("Shutdown signal received, stopping daemon");
                                daemon.stop(2);
                            },
                            "ReplDaemon-ShutdownHook"));

            logger.info("ReplDaemon is running");
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            logger.info("ReplDaemon interrupted", e);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Fatal error in ReplDaemon", e);
            System.exit(1);
        }
    }
}
