package org.shale.exception;

import lombok.Getter;

@Getter
public class UnreachableVersionException extends MigrationPreconditionException {
    private final int fromVersion;
    private final int toVersion;

    public UnreachableVersionException(int fromVersion, int toVersion) {
        super("Unable to migrate from " + fromVersion + " to " + toVersion
                + ": versions are only applied forward (reset the database to start over)");
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
    }
}
