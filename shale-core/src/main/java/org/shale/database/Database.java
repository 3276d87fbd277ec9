package org.shale.database;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * The connection a migration runs against. Implementations are bound to one connection and are
 * not thread-safe.
 *
 * <p>Errors reported by the engine are propagated as {@link SQLException}.
 */
public interface Database {

    /**
     * Runs one statement.
     *
     * @return rows affected, 0 for statements that do not modify rows
     */
    int execute(String sql, Object... params) throws SQLException;

    <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) throws SQLException;

    /**
     * @return the first row mapped, or empty when the query returns no rows
     */
    default <T> Optional<T> queryForObject(String sql, RowMapper<T> mapper, Object... params) throws SQLException {
        List<T> rows = query(sql, mapper, params);
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    /**
     * Runs {@code callback} in a transaction, or in a savepoint when one is already open. Any
     * exception rolls the work back and is rethrown unchanged.
     */
    <T> T inTransaction(TransactionCallback<T> callback) throws SQLException;

    boolean isInTransaction() throws SQLException;

    /**
     * @param identifier namespace of the counter, or null for the database-wide counter
     * @return the stored version, 0 when none was ever written
     */
    int readVersionNumber(String identifier) throws SQLException;

    void writeVersionNumber(String identifier, int versionNumber) throws SQLException;

    /**
     * Names of the user tables, engine-internal tables excluded.
     */
    List<String> listTables() throws SQLException;

    List<IndexInfo> listIndexes() throws SQLException;

    Optional<IndexInfo> indexInfo(String indexName) throws SQLException;

    List<ColumnInfo> tableInfo(String tableName) throws SQLException;

    boolean foreignKeysEnabled() throws SQLException;

    /**
     * Has no effect inside a transaction.
     */
    void setForeignKeysEnabled(boolean enabled) throws SQLException;

    List<ForeignKeyViolation> foreignKeyViolations() throws SQLException;

    long lastInsertRowId() throws SQLException;
}
