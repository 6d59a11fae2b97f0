package com.postqueue.core;

/**
 * The job store or history recorder could not complete an operation.
 *
 * <p>JDBC implementations wrap the underlying {@link java.sql.SQLException}.
 * Inside a firing this is logged and swallowed at the orchestrator boundary;
 * on the mutation path it propagates to the caller.</p>
 */
public class PersistenceException extends Exception {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
