package de.bsommerfeld.reviewinsights.db;

import de.bsommerfeld.reviewinsights.core.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * JDBC-backed {@link RelationalExecutor}. Works against PostgreSQL in
 * production and SQLite in TEST mode and in tests; the statements under
 * {@code sql/} only use syntax both understand.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per call and closed before the call
 * returns. There is no pool and no retry.
 *
 * <h3>Error classification</h3>
 * Failing to open a connection, and any {@link SQLException} whose SQLState
 * is in class {@code 08} (connection exception) or {@code 28} (invalid
 * authorization), becomes a {@link ConnectionUnavailableException}. Every
 * other {@link SQLException} becomes a {@link QueryExecutionException}.
 *
 * @see SqlLoader
 */
public class JdbcRelationalExecutor implements RelationalExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcRelationalExecutor.class);

    private final String url;
    private final Properties connectionProperties;

    public JdbcRelationalExecutor(String url) {
        this(url, null, null);
    }

    public JdbcRelationalExecutor(String url, String user, String password) {
        this.url = url;
        this.connectionProperties = new Properties();
        if (user != null) {
            connectionProperties.setProperty("user", user);
        }
        if (password != null) {
            connectionProperties.setProperty("password", password);
        }
    }

    /** Executor for the PostgreSQL store described by {@code config}. */
    public static JdbcRelationalExecutor forConfig(DatabaseConfig config) {
        return new JdbcRelationalExecutor(config.jdbcUrl(), config.getUser(), config.getPassword());
    }

    public String getUrl() {
        return url;
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(url, connectionProperties);
    }

    @Override
    public void verifyConnection() throws ConnectionUnavailableException {
        try (Connection conn = openConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load(QueryId.PING));
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                throw new ConnectionUnavailableException("Connectivity check returned no row from " + url);
            }
            LOG.info("Connected to {}", url);
        } catch (SQLException e) {
            throw new ConnectionUnavailableException("Connectivity check failed for " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<Map<String, Object>> execute(QueryId queryId, List<?> params) throws QueryExecutionException {
        String sql = SqlLoader.load(queryId);
        long start = System.nanoTime();

        try (Connection conn = openConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParameters(ps, params);
            List<Map<String, Object>> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                int columnCount = meta.getColumnCount();
                while (rs.next()) {
                    rows.add(mapRow(rs, meta, columnCount));
                }
            }
            LOG.debug("[DB] {} {} -> {} rows in {} ms", queryId, params, rows.size(),
                    (System.nanoTime() - start) / 1_000_000);
            return rows;
        } catch (SQLException e) {
            if (isConnectionFailure(e)) {
                throw new ConnectionUnavailableException(
                        "Lost connection to " + url + " while running " + queryId + ": " + e.getMessage(), e);
            }
            throw new QueryExecutionException("Query " + queryId + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Opens a connection, translating any failure into
     * {@link ConnectionUnavailableException}.
     */
    private Connection openConnection() throws ConnectionUnavailableException {
        try {
            return getConnection();
        } catch (SQLException e) {
            LOG.error("Cannot open connection to {}: {}", url, e.getMessage());
            throw new ConnectionUnavailableException("Cannot connect to " + url + ": " + e.getMessage(), e);
        }
    }

    private void bindParameters(PreparedStatement ps, List<?> params) throws SQLException {
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    /** Column labels (not names) are the keys, so {@code AS} aliases are honored. */
    private Map<String, Object> mapRow(ResultSet rs, ResultSetMetaData meta, int columnCount) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>(columnCount * 2);
        for (int i = 1; i <= columnCount; i++) {
            row.put(meta.getColumnLabel(i), rs.getObject(i));
        }
        return row;
    }

    static boolean isConnectionFailure(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            String state = cur.getSQLState();
            if (state != null && (state.startsWith("08") || state.startsWith("28"))) {
                return true;
            }
        }
        return false;
    }
}
