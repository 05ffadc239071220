package de.bsommerfeld.reviewinsights.terminal;

import ch.qos.logback.classic.Level;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.reviewinsights.core.config.GlobalConfig;
import de.bsommerfeld.reviewinsights.core.i18n.I18nService;
import de.bsommerfeld.reviewinsights.core.util.StorageUtils;
import de.bsommerfeld.reviewinsights.db.ConnectionUnavailableException;
import de.bsommerfeld.reviewinsights.db.RelationalExecutor;
import de.bsommerfeld.reviewinsights.terminal.config.AppModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point of the terminal dashboard. Wires the application, refuses to
 * start when the store is unreachable, then hands stdin/stdout to the
 * {@link ReportMenu}.
 */
public final class AppMain {

    static {
        // LOG_DIR must be set before logback initializes
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir + " (" + e.getMessage() + ")");
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(AppMain.class);
    private static final String BASE_PACKAGE = "de.bsommerfeld.reviewinsights";

    private AppMain() {
    }

    public static void main(String[] args) {
        LOG.info("Starting review-insights...");
        Injector injector = Guice.createInjector(new AppModule());
        if (injector.getInstance(GlobalConfig.class).isDebugMode()) {
            enableDebugLogging();
        }

        RelationalExecutor executor = injector.getInstance(RelationalExecutor.class);
        try {
            executor.verifyConnection();
        } catch (ConnectionUnavailableException e) {
            LOG.error("Startup aborted, store unavailable", e);
            System.err.println(injector.getInstance(I18nService.class).get("connection.unavailable", e.getMessage()));
            System.exit(ReportMenu.EXIT_CONNECTION_LOST);
            return;
        }

        ReportMenu menu = injector.getInstance(ReportMenu.class);
        int status = menu.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out);
        LOG.info("Session ended with status {}", status);
        System.exit(status);
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getLogger(BASE_PACKAGE) instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
            LOG.info("Debug mode enabled, logging {} at DEBUG", BASE_PACKAGE);
        }
    }
}
