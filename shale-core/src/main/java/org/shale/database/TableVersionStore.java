package org.shale.database;

import lombok.Getter;

import java.sql.SQLException;

/**
 * Keeps one version per identifier in a bookkeeping table, so several schemas can share a
 * database. The table is created on first write.
 */
@Getter
public class TableVersionStore implements VersionStore {
    private final String identifier;

    public TableVersionStore(String identifier) {
        this.identifier = identifier;
    }

    @Override
    public int read(Database database) throws SQLException {
        if (!tableExists(database)) {
            return 0;
        }
        return database.queryForObject(
                        "SELECT version FROM " + TABLE_NAME + " WHERE identifier = ?",
                        (rs, i) -> {
                            String raw = rs.getString(1);
                            try {
                                return raw == null ? 0 : Integer.parseInt(raw.trim());
                            } catch (NumberFormatException e) {
                                return 0;
                            }
                        },
                        identifier)
                .orElse(0);
    }

    @Override
    public void write(Database database, int versionNumber) throws SQLException {
        database.execute("CREATE TABLE IF NOT EXISTS " + TABLE_NAME
                + " (identifier TEXT PRIMARY KEY, version INTEGER NOT NULL)");
        database.execute("INSERT OR REPLACE INTO " + TABLE_NAME + " (identifier, version) VALUES (?, ?)",
                identifier, versionNumber);
    }

    private static boolean tableExists(Database database) throws SQLException {
        return database.queryForObject(
                "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?",
                (rs, i) -> Boolean.TRUE,
                TABLE_NAME).isPresent();
    }
}
