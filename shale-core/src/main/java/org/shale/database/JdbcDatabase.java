package org.shale.database;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link Database} over a JDBC connection to SQLite. The connection is owned by the caller and
 * is not closed here.
 */
@Slf4j
public class JdbcDatabase implements Database {
    @Getter
    private final Connection connection;

    public JdbcDatabase(Connection connection) {
        this.connection = connection;
    }

    @Override
    public int execute(String sql, Object... params) throws SQLException {
        log.trace("execute: {}", sql);
        if (params.length == 0) {
            try (Statement st = connection.createStatement()) {
                st.execute(sql);
                return Math.max(st.getUpdateCount(), 0);
            }
        }
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            ps.execute();
            return Math.max(ps.getUpdateCount(), 0);
        }
    }

    @Override
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) throws SQLException {
        log.trace("query: {}", sql);
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> rows = new ArrayList<>();
                int rowNum = 0;
                while (rs.next()) {
                    rows.add(mapper.mapRow(rs, rowNum++));
                }
                return rows;
            }
        }
    }

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) throws SQLException {
        if (!connection.getAutoCommit()) {
            return inSavepoint(callback);
        }
        connection.setAutoCommit(false);
        try {
            T result = callback.doInTransaction(this);
            connection.commit();
            return result;
        } catch (SQLException | RuntimeException | Error e) {
            rollbackQuietly(e);
            throw e;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    private <T> T inSavepoint(TransactionCallback<T> callback) throws SQLException {
        Savepoint savepoint = connection.setSavepoint();
        try {
            T result = callback.doInTransaction(this);
            connection.releaseSavepoint(savepoint);
            return result;
        } catch (SQLException | RuntimeException | Error e) {
            try {
                connection.rollback(savepoint);
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
    }

    private void rollbackQuietly(Throwable failure) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }

    @Override
    public boolean isInTransaction() throws SQLException {
        return !connection.getAutoCommit();
    }

    @Override
    public int readVersionNumber(String identifier) throws SQLException {
        return VersionStore.forIdentifier(identifier).read(this);
    }

    @Override
    public void writeVersionNumber(String identifier, int versionNumber) throws SQLException {
        VersionStore.forIdentifier(identifier).write(this, versionNumber);
    }

    @Override
    public List<String> listTables() throws SQLException {
        return query("SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite\\_%' ESCAPE '\\'",
                (rs, i) -> rs.getString(1));
    }

    @Override
    public List<IndexInfo> listIndexes() throws SQLException {
        List<String> names = query(
                "SELECT name FROM sqlite_master WHERE type = 'index' AND sql IS NOT NULL",
                (rs, i) -> rs.getString(1));
        List<IndexInfo> result = new ArrayList<>(names.size());
        for (String name : names) {
            indexInfo(name).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public Optional<IndexInfo> indexInfo(String indexName) throws SQLException {
        Optional<String> tableName = queryForObject(
                "SELECT tbl_name FROM sqlite_master WHERE type = 'index' AND name = ?",
                (rs, i) -> rs.getString(1), indexName);
        if (tableName.isEmpty()) {
            return Optional.empty();
        }
        IndexInfo.IndexInfoBuilder builder = IndexInfo.builder()
                .name(indexName)
                .tableName(tableName.get());
        // index_list: seq, name, unique, origin, partial
        query("PRAGMA index_list(" + quote(tableName.get()) + ")", (rs, i) -> {
            if (indexName.equals(rs.getString("name"))) {
                builder.unique(rs.getInt("unique") == 1)
                        .partial(rs.getInt("partial") == 1);
            }
            return null;
        });
        // index_info: seqno, cid, name
        builder.columns(query("PRAGMA index_info(" + quote(indexName) + ")", (rs, i) -> rs.getString("name")));
        return Optional.of(builder.build());
    }

    @Override
    public List<ColumnInfo> tableInfo(String tableName) throws SQLException {
        return query("PRAGMA table_info(" + quote(tableName) + ")", (rs, i) -> ColumnInfo.builder()
                .position(rs.getInt("cid"))
                .name(rs.getString("name"))
                .declaredType(rs.getString("type"))
                .notNull(rs.getInt("notnull") == 1)
                .defaultValue(rs.getString("dflt_value"))
                .primaryKeyPosition(rs.getInt("pk"))
                .build());
    }

    @Override
    public boolean foreignKeysEnabled() throws SQLException {
        return queryForObject("PRAGMA foreign_keys", (rs, i) -> rs.getInt(1) == 1).orElse(false);
    }

    @Override
    public void setForeignKeysEnabled(boolean enabled) throws SQLException {
        execute("PRAGMA foreign_keys = " + (enabled ? "ON" : "OFF"));
    }

    @Override
    public List<ForeignKeyViolation> foreignKeyViolations() throws SQLException {
        // table, rowid, parent, fkid
        return query("PRAGMA foreign_key_check", (rs, i) -> {
            long rowId = rs.getLong(2);
            boolean noRowId = rs.wasNull();
            return ForeignKeyViolation.builder()
                    .tableName(rs.getString(1))
                    .rowId(noRowId ? null : rowId)
                    .parentTableName(rs.getString(3))
                    .foreignKeyIndex(rs.getInt(4))
                    .build();
        });
    }

    @Override
    public long lastInsertRowId() throws SQLException {
        return queryForObject("SELECT last_insert_rowid()", (rs, i) -> rs.getLong(1)).orElse(0L);
    }

    private static void bind(PreparedStatement ps, Object[] params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            ps.setObject(i + 1, params[i]);
        }
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
