package org.shale.migration.spi.dialect;

import org.shale.migration.operation.ColumnSource;
import org.shale.migration.operation.MigrationOperation;
import org.shale.migration.spi.visitor.SqlGeneratingVisitor;
import org.shale.model.ColumnModel;
import org.shale.model.ConstraintModel;
import org.shale.model.IndexModel;
import org.shale.model.PrimaryKeyModel;
import org.shale.model.TableModel;

import java.util.List;

public interface DdlDialect {
    String quoteIdentifier(String raw);

    // Table
    String openCreateTable(String tableName);
    String closeCreateTable();
    String getCreateTableSql(TableModel table);
    String getDropTableSql(String tableName, boolean ifExists);
    String getRenameTableSql(String oldTableName, String newTableName);
    String getCopyDataSql(String targetTable, String sourceTable, List<ColumnSource> columnPlan);

    // Column
    String getColumnDefinitionSql(ColumnModel column, PrimaryKeyModel primaryKey);
    String getAddColumnSql(String table, ColumnModel column);

    // Constraints & Indexes
    String getConstraintDefinitionSql(ConstraintModel constraint);
    String indexStatement(IndexModel index, boolean ifNotExists);
    String getDropIndexSql(String indexName, boolean ifExists);

    SqlGeneratingVisitor createVisitor();

    /**
     * Renders an operation to the statements that apply it, in execution order. Opaque
     * operations render to nothing.
     */
    default List<String> render(MigrationOperation operation) {
        SqlGeneratingVisitor visitor = createVisitor();
        operation.accept(visitor);
        return visitor.getStatements();
    }
}
