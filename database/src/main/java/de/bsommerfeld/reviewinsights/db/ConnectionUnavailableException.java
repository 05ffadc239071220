package de.bsommerfeld.reviewinsights.db;

/**
 * Thrown when the store cannot be reached or refuses the credentials. Unlike
 * its supertype this ends the whole session: no report may run, and no empty
 * result may be shown in place of the missing data.
 */
public class ConnectionUnavailableException extends QueryExecutionException {

    public ConnectionUnavailableException(String message) {
        super(message);
    }

    public ConnectionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
