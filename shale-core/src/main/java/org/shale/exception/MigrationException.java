package org.shale.exception;

/**
 * Base class of every error raised while declaring a schema or migrating a database.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
