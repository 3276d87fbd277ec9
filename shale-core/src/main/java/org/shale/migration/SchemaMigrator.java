package org.shale.migration;

import lombok.extern.slf4j.Slf4j;
import org.shale.database.Database;
import org.shale.database.ForeignKeyViolation;
import org.shale.database.VersionStore;
import org.shale.exception.ForeignKeyViolationException;
import org.shale.exception.MigrationException;
import org.shale.exception.MigrationExecutionException;
import org.shale.exception.MigrationPreconditionException;
import org.shale.exception.UnknownDatabaseVersionException;
import org.shale.exception.UnreachableVersionException;
import org.shale.migration.dialect.sqlite.SqliteDialect;
import org.shale.migration.operation.ExecuteOperation;
import org.shale.migration.operation.MigrationOperation;
import org.shale.migration.operation.OperationKind;
import org.shale.migration.spi.dialect.DdlDialect;
import org.shale.schema.Schema;
import org.shale.schema.Version;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies a {@link Schema} to a database.
 *
 * <p>A run reads the recorded version once, then applies every version above it up to the
 * target inside a single transaction (a savepoint when the caller already opened one) and
 * records the target last. Foreign key enforcement is switched off for the run and restored
 * afterwards. Any failure rolls the whole run back.
 */
@Slf4j
public class SchemaMigrator {
    private final Schema schema;
    private final DdlDialect dialect;

    public SchemaMigrator(Schema schema) {
        this(schema, new SqliteDialect());
    }

    public SchemaMigrator(Schema schema, DdlDialect dialect) {
        this.schema = schema;
        this.dialect = dialect;
    }

    public boolean migrate(Database database, int target, MigrationOptions options) {
        checkTarget(target);
        schema.validate();

        int current = readCurrentVersion(database);
        boolean resetFirst = false;
        boolean dropEverything = false;

        if (current != 0 && !schema.declares(current)) {
            if (!options.isResetUnknownVersions()) {
                throw new UnknownDatabaseVersionException(current);
            }
            log.warn("Database version {} is not declared by schema '{}'; dropping all tables",
                    current, schema.getIdentifier());
            resetFirst = true;
            dropEverything = true;
        } else if (current == target) {
            log.debug("Schema '{}' already at version {}", schema.getIdentifier(), current);
            return false;
        } else if (target < current) {
            if (!options.isResetOnDowngrade() && target != 0) {
                throw new UnreachableVersionException(current, target);
            }
            resetFirst = true;
        }

        int from = resetFirst ? 0 : current;
        log.info("Migrating schema '{}' from version {} to {}", schema.getIdentifier(), current, target);
        run(database, from, target, resetFirst, dropEverything, options);
        log.info("Schema '{}' is at version {}", schema.getIdentifier(), target);
        return true;
    }

    public void reset(Database database) {
        schema.validate();
        log.info("Resetting schema '{}'", schema.getIdentifier());
        run(database, 0, 0, true, false, MigrationOptions.defaults());
    }

    private void checkTarget(int target) {
        if (target < 0) {
            throw new MigrationPreconditionException("Target version must not be negative, got " + target);
        }
        if (target > schema.latestVersionNumber()) {
            throw new MigrationPreconditionException("Target version " + target + " is above the latest declared version "
                    + schema.latestVersionNumber());
        }
        if (target != 0 && target < schema.firstVersionNumber()) {
            throw new MigrationPreconditionException("Target version " + target + " is below the first declared version "
                    + schema.firstVersionNumber());
        }
    }

    private int readCurrentVersion(Database database) {
        try {
            return database.readVersionNumber(schema.getIdentifier());
        } catch (SQLException e) {
            throw new MigrationException("Unable to read the version of schema '" + schema.getIdentifier() + "'", e);
        }
    }

    private void run(Database database, int from, int target, boolean resetFirst, boolean dropEverything,
                     MigrationOptions options) {
        boolean restoreForeignKeys = disableForeignKeys(database);
        try {
            database.inTransaction(db -> {
                if (resetFirst) {
                    dropTables(db, dropEverything);
                }
                for (int n = from + 1; n <= target; n++) {
                    applyVersion(db, schema.version(n).orElseThrow(), options);
                }
                writeVersion(db, target);
                return null;
            });
        } catch (SQLException e) {
            throw new MigrationException("Migration of schema '" + schema.getIdentifier() + "' to version "
                    + target + " failed: " + e.getMessage(), e);
        } finally {
            if (restoreForeignKeys) {
                enableForeignKeys(database);
            }
        }
    }

    private void applyVersion(Database db, Version version, MigrationOptions options) {
        log.info("Applying version {} ({} operation(s))", version.number(), version.operations().size());
        for (MigrationOperation op : version.operations()) {
            try {
                apply(db, op);
                if (op.kind() == OperationKind.REBUILD_TABLE && options.isCheckForeignKeys()) {
                    checkForeignKeys(db, version.number(), op.target());
                }
            } catch (MigrationException e) {
                throw e;
            } catch (SQLException | RuntimeException e) {
                throw new MigrationExecutionException(version.number(), op.kind(), op.target(), e);
            }
        }
    }

    private void apply(Database db, MigrationOperation op) throws SQLException {
        if (op instanceof ExecuteOperation execute) {
            log.debug("execute: {}", execute.description());
            execute.block().execute(db);
            return;
        }
        for (String sql : dialect.render(op)) {
            log.debug("{}", sql);
            db.execute(sql);
        }
    }

    private void checkForeignKeys(Database db, int versionNumber, String tableName) throws SQLException {
        List<ForeignKeyViolation> violations = db.foreignKeyViolations();
        if (!violations.isEmpty()) {
            throw new ForeignKeyViolationException(versionNumber, tableName, violations);
        }
    }

    /**
     * Drops the tables this schema knows about, or every user table when {@code everything} is
     * set. The version bookkeeping table is kept.
     */
    private void dropTables(Database db, boolean everything) throws SQLException {
        List<String> existing = db.listTables();
        List<String> toDrop = new ArrayList<>();
        if (everything) {
            toDrop.addAll(existing);
        } else {
            for (String index : schema.knownIndexNames()) {
                db.execute(dialect.getDropIndexSql(index, true));
            }
            schema.knownTableNames().stream().filter(existing::contains).forEach(toDrop::add);
        }
        toDrop.remove(VersionStore.TABLE_NAME);
        for (String table : toDrop) {
            log.debug("Dropping table '{}'", table);
            db.execute(dialect.getDropTableSql(table, true));
        }
    }

    private void writeVersion(Database db, int versionNumber) {
        try {
            db.writeVersionNumber(schema.getIdentifier(), versionNumber);
        } catch (SQLException e) {
            throw new MigrationException("Unable to record version " + versionNumber + " of schema '"
                    + schema.getIdentifier() + "'", e);
        }
    }

    private boolean disableForeignKeys(Database database) {
        try {
            if (database.isInTransaction() || !database.foreignKeysEnabled()) {
                return false;
            }
            database.setForeignKeysEnabled(false);
            return true;
        } catch (SQLException e) {
            throw new MigrationException("Unable to disable foreign keys", e);
        }
    }

    private void enableForeignKeys(Database database) {
        try {
            database.setForeignKeysEnabled(true);
        } catch (SQLException e) {
            log.error("Unable to re-enable foreign keys", e);
        }
    }
}
