package de.bsommerfeld.reviewinsights.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection parameters of the PostgreSQL store holding the review dataset.
 * Values are persisted in the {@code [database]} table of config.toml.
 */
public class DatabaseConfig {

    @JsonProperty("host")
    private String host = "localhost";

    @JsonProperty("port")
    private int port = 5432;

    @JsonProperty("user")
    private String user = "postgres";

    @JsonProperty("password")
    private String password = "";

    @JsonProperty("name")
    private String name = "produtosAmazon";

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /** JDBC URL of the configured store, e.g. {@code jdbc:postgresql://localhost:5432/produtosAmazon}. */
    @JsonIgnore
    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + name;
    }

    @Override
    public String toString() {
        // never includes the password
        return "DatabaseConfig[" + user + "@" + host + ":" + port + "/" + name + "]";
    }
}
