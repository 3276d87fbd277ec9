package org.shale.migration.operation;

import org.shale.database.Database;

import java.sql.SQLException;

/**
 * Arbitrary work run during a migration, inside the migration's transaction. The schema model
 * cannot see what it does, so it should only change data, never structure.
 */
@FunctionalInterface
public interface ExecuteBlock {
    void execute(Database database) throws SQLException;
}
