package ai.repld.daemon;

import ai.repld.daemon.http.ReplHttpServer;
import ai.repld.repl.CompilerId;
import ai.repld.repl.LoggingMessageCollector;
import ai.repld.repl.LoggingOperationsTracer;
import ai.repld.repl.MessageCollector;
import ai.repld.repl.ReplCompiler;
import ai.repld.repl.ReplCompilers;
import ai.repld.repl.ReplInitializationException;
import ai.repld.repl.ReplService;
import java.io.IOException;
import java.util.UUID;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Wires the REPL service, its HTTP front end and idle eviction together. */
public final class ReplDaemon {
    private static final Logger logger = LogManager.getLogger(ReplDaemon.class);

    private final UUID daemonId;
    private final ReplService service;
    private final ReplHttpServer httpServer;

    @Nullable
    private final IdleSessionEvictor evictor;

    public ReplDaemon(ReplDaemonConfig config) throws IOException {
        this(config, createCompiler(config, new LoggingMessageCollector()));
    }

    /** @param replCompiler the engine, or null to run degraded */
    public ReplDaemon(ReplDaemonConfig config, @Nullable ReplCompiler replCompiler) throws IOException {
        this.daemonId = UUID.randomUUID();
        var tracer = config.trace() ? new LoggingOperationsTracer() : null;
        this.service = new ReplService(config.port(), replCompiler, tracer);
        this.httpServer =
                new ReplHttpServer(daemonId, service, config.host(), config.port(), config.httpThreads());
        this.evictor = config.idleEvictionEnabled()
                ? new IdleSessionEvictor(service, config.idleTimeout(), config.evictionInterval())
                : null;

        logger.info(
                "Initializing ReplDaemon: daemonId={}, listen={}:{}, template='{}', idleTimeout={}, trace={}",
                daemonId,
                config.host(),
                config.port(),
                config.templateClassName(),
                config.idleTimeout(),
                config.trace());
    }

    /**
     * Build the engine, or return null if none is usable. The daemon keeps serving and every REPL call reports an
     * initialization error.
     */
    @Nullable
    static ReplCompiler createCompiler(ReplDaemonConfig config, MessageCollector messageCollector) {
        try {
            return ReplCompilers.makeReplCompiler(
                    CompilerId.current(), config.templateClasspath(), config.templateClassName(), messageCollector);
        } catch (ReplInitializationException e) {
            logger.error("REPL is unavailable ({}): {}", e.getReason(), e.getMessage(), e);
            return null;
        }
    }

    public void start() {
        httpServer.start();
        if (evictor != null) {
            evictor.start();
        }
        logger.info("ReplDaemon {} listening on port {}", daemonId, httpServer.getPort());
    }

    public void stop(int delaySeconds) {
        if (evictor != null) {
            evictor.close();
        }
        httpServer.stop(delaySeconds);
        service.close();
        logger.info("ReplDaemon stopped");
    }

    public int getPort() {
        return httpServer.getPort();
    }

    public ReplService getService() {
        return service;
    }
}
