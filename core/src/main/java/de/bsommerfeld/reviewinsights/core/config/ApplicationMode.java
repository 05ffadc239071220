package de.bsommerfeld.reviewinsights.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Which store the reports read from.
 *
 * <ul>
 * <li>{@link #PROD}: the PostgreSQL store described by the {@code [database]}
 * section of config.toml.</li>
 * <li>{@link #TEST}: a throw-away SQLite file seeded with generated sample
 * data; the {@code [database]} section is ignored.</li>
 * </ul>
 *
 * The mode is chosen with the {@code app.mode} system property, falling back
 * to the {@code APP_MODE} environment variable.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    static final String PROPERTY = "app.mode";
    static final String ENVIRONMENT_VARIABLE = "APP_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /** The mode this JVM was started in. */
    public static ApplicationMode get() {
        return resolve(System.getProperty(PROPERTY), System.getenv(ENVIRONMENT_VARIABLE));
    }

    /**
     * Picks the mode from an explicit property value and an environment
     * value. A non-blank property wins over the environment; blank or
     * unknown values mean {@link #PROD}.
     */
    static ApplicationMode resolve(String property, String environment) {
        String value = isBlank(property) ? environment : property;
        if (isBlank(value)) {
            return PROD;
        }
        for (ApplicationMode mode : values()) {
            if (mode.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                return mode;
            }
        }
        LOG.warn("Unknown application mode '{}', reading from the production store", value);
        return PROD;
    }

    /** Whether reports run against generated sample data instead of the configured store. */
    public boolean usesSampleData() {
        return this == TEST;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
