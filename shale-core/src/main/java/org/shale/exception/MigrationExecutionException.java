package org.shale.exception;

import lombok.Getter;
import org.shale.migration.operation.OperationKind;

/**
 * A statement failed while a migration was running. Thrown from inside the migration
 * transaction; the enclosing transaction is rolled back as it propagates, so callers of
 * {@code migrate} see a database with no trace of the run.
 */
@Getter
public class MigrationExecutionException extends MigrationException {
    private final int versionNumber;
    private final OperationKind operationKind;
    private final String target;

    public MigrationExecutionException(int versionNumber, OperationKind operationKind, String target, Throwable cause) {
        this(versionNumber, operationKind, target, describe(versionNumber, operationKind, target, cause), cause);
    }

    protected MigrationExecutionException(int versionNumber, OperationKind operationKind, String target,
                                          String message, Throwable cause) {
        super(message, cause);
        this.versionNumber = versionNumber;
        this.operationKind = operationKind;
        this.target = target;
    }

    private static String describe(int versionNumber, OperationKind kind, String target, Throwable cause) {
        String reason = cause == null ? "unknown error" : cause.getMessage();
        return String.format("Migration to version %d failed at %s '%s': %s", versionNumber, kind, target, reason);
    }
}
