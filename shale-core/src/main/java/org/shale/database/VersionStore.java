package org.shale.database;

import java.sql.SQLException;

/**
 * Where the version number of a schema is persisted.
 */
public interface VersionStore {
    String TABLE_NAME = "shale_schema_version";

    int read(Database database) throws SQLException;

    void write(Database database, int versionNumber) throws SQLException;

    /**
     * {@code PRAGMA user_version} for a null identifier, otherwise a row of the bookkeeping table
     * keyed by the identifier.
     */
    static VersionStore forIdentifier(String identifier) {
        return identifier == null ? new UserVersionStore() : new TableVersionStore(identifier);
    }
}
