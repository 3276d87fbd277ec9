package org.shale.exception;

import lombok.Getter;

@Getter
public class UnknownDatabaseVersionException extends MigrationPreconditionException {
    private final int databaseVersion;

    public UnknownDatabaseVersionException(int databaseVersion) {
        super("The database version (" + databaseVersion + ") isn't defined in the schema.");
        this.databaseVersion = databaseVersion;
    }
}
