package de.bsommerfeld.reviewinsights.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of config.toml. Loaded once at startup by {@link ConfigLoader}; the
 * analytical core never reads it directly, it only receives the values the
 * wiring layer extracts from it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("user")
    private UserConfig user = new UserConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }

    public UserConfig getUser() {
        return user;
    }
}
