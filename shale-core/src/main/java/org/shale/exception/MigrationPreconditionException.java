package org.shale.exception;

/**
 * A migration request cannot be satisfied. Raised before a transaction is opened.
 */
public class MigrationPreconditionException extends MigrationException {

    public MigrationPreconditionException(String message) {
        super(message);
    }
}
