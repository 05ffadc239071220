package de.bsommerfeld.reviewinsights.db;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to the review dataset. The analytical layer talks to the
 * store exclusively through this contract.
 *
 * <p>
 * Rows are returned as insertion-ordered maps from column label to value, in
 * the order the statement produced them. Values are whatever the driver
 * returns ({@code Integer}, {@code Long}, {@code BigDecimal}, {@code Double},
 * {@code String}, {@code java.sql.Date}, ...) or {@code null} for SQL NULL;
 * interpreting them is the caller's job.
 *
 * <p>
 * Implementations do not retry and do not pool.
 */
public interface RelationalExecutor {

    /**
     * Runs the statement identified by {@code queryId} with the given
     * positional parameters.
     *
     * @throws ConnectionUnavailableException if the store is unreachable or
     *                                        authentication failed
     * @throws QueryExecutionException        if the statement failed, e.g. a
     *                                        relation or column does not exist
     */
    List<Map<String, Object>> execute(QueryId queryId, List<?> params) throws QueryExecutionException;

    /**
     * Opens and validates one connection.
     *
     * @throws ConnectionUnavailableException if that is not possible
     */
    void verifyConnection() throws ConnectionUnavailableException;
}
