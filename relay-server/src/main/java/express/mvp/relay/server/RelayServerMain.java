package express.mvp.relay.server;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.TimeUnit;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point.
 *
 * <p>Reads {@code PORT}, {@code HOST}, {@code RELAY_DEBUG} and {@code HEARTBEAT_INTERVAL} from the
 * environment, starts the server and stops it gracefully on JVM shutdown.
 */
public final class RelayServerMain {

    private static final Logger LOGGER = Logger.getLogger(RelayServerMain.class.getName());

    /** Held so the level set in debug mode is not lost to garbage collection. */
    private static final Logger RELAY_LOGGER = Logger.getLogger("express.mvp.relay");

    private static final long STARTUP_TIMEOUT_SECONDS = 10;

    private RelayServerMain() {}

    public static void main(String[] args) throws InterruptedException {
        RelayServerConfig config;
        try {
            config = RelayServerConfig.fromEnvironment(System.getenv());
        } catch (IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Invalid configuration: {0}", e.getMessage());
            System.exit(2);
            return;
        }
        configureLogging(config.isDebug());
        LOGGER.log(Level.INFO, "Starting relay server with {0}", config);

        RelayServer server = new RelayServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "relay-server-shutdown"));
        server.start();
        if (!server.awaitReady(STARTUP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            LOGGER.severe("Relay server did not start within " + STARTUP_TIMEOUT_SECONDS + "s");
            System.exit(1);
        }
    }

    /**
     * Loads the bundled {@code logging.properties} unless the JVM was given its own, then lowers
     * the relay loggers to FINE in debug mode.
     */
    static void configureLogging(boolean debug) {
        if (System.getProperty("java.util.logging.config.file") == null) {
            try (InputStream in = RelayServerMain.class.getResourceAsStream("/logging.properties")) {
                if (in != null) {
                    LogManager.getLogManager().readConfiguration(in);
                }
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Could not load logging.properties", e);
            }
        }
        if (debug) {
            RELAY_LOGGER.setLevel(Level.FINE);
            for (Handler handler : Logger.getLogger("").getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    handler.setLevel(Level.FINE);
                }
            }
        }
    }
}
