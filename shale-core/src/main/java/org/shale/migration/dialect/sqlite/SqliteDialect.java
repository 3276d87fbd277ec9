package org.shale.migration.dialect.sqlite;

import org.shale.migration.CreateTableBuilder;
import org.shale.migration.operation.ColumnSource;
import org.shale.migration.spi.dialect.DdlDialect;
import org.shale.migration.spi.visitor.SqlGeneratingVisitor;
import org.shale.model.ColumnModel;
import org.shale.model.ConstraintModel;
import org.shale.model.IndexModel;
import org.shale.model.PrimaryKeyModel;
import org.shale.model.TableModel;

import java.util.List;
import java.util.stream.Collectors;

/**
 * SQL for SQLite. Its {@code ALTER TABLE} can only rename a table or append a column, which is
 * why every other table change is compiled into a rebuild.
 */
public class SqliteDialect implements DdlDialect {

    @Override
    public String quoteIdentifier(String raw) {
        return "\"" + raw.replace("\"", "\"\"") + "\"";
    }

    // DdlDialect - Table

    @Override
    public String openCreateTable(String tableName) {
        return "CREATE TABLE " + quoteIdentifier(tableName) + " (\n";
    }

    @Override
    public String closeCreateTable() {
        return "\n)";
    }

    @Override
    public String getCreateTableSql(TableModel table) {
        return new CreateTableBuilder(table.getName(), this)
                .defaultsFrom(table)
                .build();
    }

    @Override
    public String getDropTableSql(String tableName, boolean ifExists) {
        return "DROP TABLE " + (ifExists ? "IF EXISTS " : "") + quoteIdentifier(tableName);
    }

    @Override
    public String getRenameTableSql(String oldTableName, String newTableName) {
        return "ALTER TABLE " + quoteIdentifier(oldTableName) + " RENAME TO " + quoteIdentifier(newTableName);
    }

    @Override
    public String getCopyDataSql(String targetTable, String sourceTable, List<ColumnSource> columnPlan) {
        if (columnPlan.isEmpty()) {
            // 이어받는 컬럼이 없어도 행 수는 유지한다 (새 컬럼은 DEFAULT/NULL)
            return "INSERT INTO " + quoteIdentifier(targetTable) + " (rowid) SELECT rowid FROM "
                    + quoteIdentifier(sourceTable);
        }
        String targets = columnPlan.stream()
                .map(s -> quoteIdentifier(s.targetColumn()))
                .collect(Collectors.joining(", "));
        String values = columnPlan.stream()
                .map(s -> s.isCarried() ? quoteIdentifier(s.sourceColumn()) : s.expression())
                .collect(Collectors.joining(", "));
        return "INSERT INTO " + quoteIdentifier(targetTable) + " (" + targets + ") SELECT " + values
                + " FROM " + quoteIdentifier(sourceTable);
    }

    // DdlDialect - Column

    @Override
    public String getColumnDefinitionSql(ColumnModel column, PrimaryKeyModel primaryKey) {
        StringBuilder sb = new StringBuilder(quoteIdentifier(column.getName()));
        String type = column.getType().getSqlKeyword();
        if (!type.isEmpty()) {
            sb.append(' ').append(type);
        }
        if (primaryKey != null) {
            sb.append(" PRIMARY KEY");
            if (primaryKey.isAutoincrement()) {
                sb.append(" AUTOINCREMENT");
            }
        }
        for (String constraint : column.getConstraints()) {
            if (!constraint.isBlank()) {
                sb.append(' ').append(constraint.trim());
            }
        }
        return sb.toString();
    }

    @Override
    public String getAddColumnSql(String table, ColumnModel column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD COLUMN " + getColumnDefinitionSql(column, null);
    }

    // DdlDialect - Constraints & Indexes

    @Override
    public String getConstraintDefinitionSql(ConstraintModel constraint) {
        if (constraint.isNamed()) {
            return "CONSTRAINT " + quoteIdentifier(constraint.getName()) + " " + constraint.getDefinition();
        }
        return constraint.getDefinition();
    }

    @Override
    public String indexStatement(IndexModel index, boolean ifNotExists) {
        StringBuilder sb = new StringBuilder("CREATE ");
        if (index.isUnique()) {
            sb.append("UNIQUE ");
        }
        sb.append("INDEX ");
        if (ifNotExists) {
            sb.append("IF NOT EXISTS ");
        }
        sb.append(quoteIdentifier(index.getName()))
                .append(" ON ").append(quoteIdentifier(index.getTableName()))
                .append(" (")
                .append(index.getColumns().stream().map(this::quoteIdentifier).collect(Collectors.joining(", ")))
                .append(')');
        if (index.getWhere() != null && !index.getWhere().isBlank()) {
            sb.append(" WHERE ").append(index.getWhere());
        }
        return sb.toString();
    }

    @Override
    public String getDropIndexSql(String indexName, boolean ifExists) {
        return "DROP INDEX " + (ifExists ? "IF EXISTS " : "") + quoteIdentifier(indexName);
    }

    @Override
    public SqlGeneratingVisitor createVisitor() {
        return new SqliteMigrationVisitor(this);
    }
}
