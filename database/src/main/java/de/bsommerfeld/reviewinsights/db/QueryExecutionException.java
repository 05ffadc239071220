package de.bsommerfeld.reviewinsights.db;

/**
 * Thrown when a query could not be executed or returned data the caller
 * cannot interpret. Affects a single report only.
 */
public class QueryExecutionException extends Exception {

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
