package org.shale.database;

import java.sql.SQLException;

/**
 * Keeps the version in the database header through {@code PRAGMA user_version}.
 */
public class UserVersionStore implements VersionStore {

    @Override
    public int read(Database database) throws SQLException {
        return database.queryForObject("PRAGMA user_version", (rs, i) -> rs.getInt(1)).orElse(0);
    }

    @Override
    public void write(Database database, int versionNumber) throws SQLException {
        // PRAGMA 은 바인드 파라미터를 받지 않는다
        database.execute("PRAGMA user_version = " + versionNumber);
    }
}
