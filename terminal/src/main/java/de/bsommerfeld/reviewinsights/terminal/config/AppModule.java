package de.bsommerfeld.reviewinsights.terminal.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.reviewinsights.core.config.ApplicationMode;
import de.bsommerfeld.reviewinsights.core.config.ConfigLoader;
import de.bsommerfeld.reviewinsights.core.config.DatabaseConfig;
import de.bsommerfeld.reviewinsights.core.config.GlobalConfig;
import de.bsommerfeld.reviewinsights.core.config.UserConfig;
import de.bsommerfeld.reviewinsights.core.util.SampleDataGenerator;
import de.bsommerfeld.reviewinsights.core.util.StorageUtils;
import de.bsommerfeld.reviewinsights.db.JdbcRelationalExecutor;
import de.bsommerfeld.reviewinsights.db.RelationalExecutor;
import de.bsommerfeld.reviewinsights.db.SampleDatabase;
import de.bsommerfeld.reviewinsights.terminal.render.ChartRenderer;
import de.bsommerfeld.reviewinsights.terminal.render.TextChartRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;

/**
 * Guice wiring for the terminal application.
 *
 * <p>
 * The configuration is loaded once and bound as instances. The
 * {@link RelationalExecutor} depends on the {@link ApplicationMode}: PROD
 * points it at the configured PostgreSQL store, TEST at a freshly seeded
 * SQLite file in the temp directory.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    static final int SAMPLE_PRODUCTS = 250;
    static final long SAMPLE_SEED = 20051101L;

    private final GlobalConfig config;
    private final ApplicationMode mode;

    /** Loads config.toml from the application data directory. */
    public AppModule() {
        this(loadConfig(), ApplicationMode.get());
    }

    public AppModule(GlobalConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    private static GlobalConfig loadConfig() {
        Path configPath = StorageUtils.getConfigFile(StorageUtils.APP_NAME);
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
        return ConfigLoader.load(configPath);
    }

    @Override
    protected void configure() {
        LOG.info("Application mode: {}", mode);
        bind(GlobalConfig.class).toInstance(config);
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(UserConfig.class).toInstance(config.getUser());
        bind(ApplicationMode.class).toInstance(mode);
        bind(ChartRenderer.class).to(TextChartRenderer.class);
    }

    @Provides
    @Singleton
    RelationalExecutor provideExecutor(DatabaseConfig databaseConfig) {
        if (mode.usesSampleData()) {
            LOG.warn("#########################################################");
            LOG.warn("#  TEST MODE: reports run against generated sample data  #");
            LOG.warn("#########################################################");
            return sampleExecutor();
        }
        LOG.info("Using {}", databaseConfig);
        return JdbcRelationalExecutor.forConfig(databaseConfig);
    }

    private JdbcRelationalExecutor sampleExecutor() {
        try {
            Path file = Files.createTempFile("review-insights-sample-", ".db");
            file.toFile().deleteOnExit();
            SampleDatabase database = SampleDatabase.create(file);
            database.seed(SampleDataGenerator.generate(SAMPLE_PRODUCTS, SAMPLE_SEED));
            return database.executor();
        } catch (IOException | SQLException e) {
            throw new IllegalStateException("Failed to prepare the TEST mode sample database", e);
        }
    }
}
