package org.shale.migration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.shale.database.Database;
import org.shale.exception.MigrationException;
import org.shale.exception.MigrationPreconditionException;
import org.shale.exception.SchemaDeclarationException;
import org.shale.exception.UnknownDatabaseVersionException;
import org.shale.model.ColumnType;
import org.shale.schema.Schema;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchemaMigratorTest {

    @Mock
    private Database db;

    private final Schema schema = Schema.builder("app")
            .version(1, v -> v.createTable("people", t -> t.primaryKey("id").column("name", ColumnType.TEXT)))
            .version(2, v -> v.alterTable("people", t -> t.addColumn("email", ColumnType.TEXT)))
            .build();

    private final SchemaMigrator migrator = new SchemaMigrator(schema);

    @Test
    void targetOutOfRangeTouchesNothing() {
        assertThatThrownBy(() -> migrator.migrate(db, 3, MigrationOptions.defaults()))
                .isInstanceOf(MigrationPreconditionException.class);
        assertThatThrownBy(() -> migrator.migrate(db, -1, MigrationOptions.defaults()))
                .isInstanceOf(MigrationPreconditionException.class);

        verifyNoInteractions(db);
    }

    @Test
    void invalidSchemaTouchesNothing() {
        Schema broken = Schema.builder(null)
                .version(1, v -> v.dropTable("missing"))
                .build();

        assertThatThrownBy(() -> new SchemaMigrator(broken).migrate(db, 1, MigrationOptions.defaults()))
                .isInstanceOf(SchemaDeclarationException.class);

        verifyNoInteractions(db);
    }

    @Test
    void alreadyAtTarget() throws SQLException {
        when(db.readVersionNumber("app")).thenReturn(2);

        assertThat(migrator.migrate(db, 2, MigrationOptions.defaults())).isFalse();

        verify(db, never()).inTransaction(any());
        verify(db, never()).setForeignKeysEnabled(anyBoolean());
    }

    @Test
    void unknownVersionIsReportedBeforeAnyChange() throws SQLException {
        when(db.readVersionNumber("app")).thenReturn(12);

        assertThatThrownBy(() -> migrator.migrate(db, 2, MigrationOptions.defaults()))
                .isInstanceOf(UnknownDatabaseVersionException.class);

        verify(db, never()).inTransaction(any());
    }

    @Test
    void unreadableVersion() throws SQLException {
        when(db.readVersionNumber("app")).thenThrow(new SQLException("file is not a database"));

        assertThatThrownBy(() -> migrator.migrate(db, 2, MigrationOptions.defaults()))
                .isInstanceOf(MigrationException.class)
                .hasMessageContaining("'app'")
                .hasRootCauseMessage("file is not a database");
    }

    @Test
    void foreignKeysAreRestoredAfterFailure() throws SQLException {
        when(db.isInTransaction()).thenReturn(false);
        when(db.foreignKeysEnabled()).thenReturn(true);
        when(db.inTransaction(any())).thenThrow(new SQLException("disk I/O error"));

        assertThatThrownBy(() -> migrator.migrate(db, 2, MigrationOptions.defaults()))
                .isInstanceOf(MigrationException.class)
                .hasMessageContaining("disk I/O error");

        var order = inOrder(db);
        order.verify(db).setForeignKeysEnabled(false);
        order.verify(db).inTransaction(any());
        order.verify(db).setForeignKeysEnabled(true);
    }

    @Test
    void foreignKeysLeftAloneInsideCallerTransaction() throws SQLException {
        when(db.isInTransaction()).thenReturn(true);

        assertThat(migrator.migrate(db, 2, MigrationOptions.defaults())).isTrue();

        verify(db).inTransaction(any());
        verify(db, never()).foreignKeysEnabled();
        verify(db, never()).setForeignKeysEnabled(anyBoolean());
    }

    @Test
    void foreignKeysLeftOffWhenAlreadyOff() throws SQLException {
        when(db.isInTransaction()).thenReturn(false);
        when(db.foreignKeysEnabled()).thenReturn(false);

        migrator.migrate(db, 1, MigrationOptions.defaults());

        verify(db, never()).setForeignKeysEnabled(anyBoolean());
    }
}
