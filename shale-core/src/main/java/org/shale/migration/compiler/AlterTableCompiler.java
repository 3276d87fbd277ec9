package org.shale.migration.compiler;

import lombok.extern.slf4j.Slf4j;
import org.shale.exception.SchemaDeclarationException;
import org.shale.migration.operation.AddColumnOperation;
import org.shale.migration.operation.ColumnSource;
import org.shale.migration.operation.MigrationOperation;
import org.shale.migration.operation.RebuildTableOperation;
import org.shale.model.ColumnModel;
import org.shale.model.ConstraintModel;
import org.shale.model.IndexModel;
import org.shale.model.PrimaryKeyModel;
import org.shale.model.TableModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles the edits of an {@code alterTable} block into operations the engine can run.
 *
 * <p>Blocks that only append plain columns become one native {@code ADD COLUMN} per column.
 * Anything else (drops, renames, retypes, constraint changes, computed values) becomes a single
 * {@link RebuildTableOperation} covering every edit of the block, however many columns it
 * touches.
 */
@Slf4j
public class AlterTableCompiler {
    static final String TEMPORARY_SUFFIX = "_shale_tmp";

    private final IndexRemapper indexRemapper;

    public AlterTableCompiler() {
        this(new IndexRemapper());
    }

    public AlterTableCompiler(IndexRemapper indexRemapper) {
        this.indexRemapper = indexRemapper;
    }

    /**
     * @param table          the table before the block
     * @param edits          the block's edits in declaration order
     * @param indexes        indexes currently defined on the table
     * @param occupiedNames  table names taken in the working snapshot, avoided for the temporary table
     */
    public AlterTableResult compile(TableModel table, List<TableEdit> edits, List<IndexModel> indexes,
                                    Set<String> occupiedNames) {
        if (edits.isEmpty()) {
            return new AlterTableResult(table, indexes, List.of(), List.of());
        }
        if (isAdditiveOnly(edits)) {
            return compileAdditive(table, edits, indexes);
        }
        return compileRebuild(table, edits, indexes, occupiedNames);
    }

    boolean isAdditiveOnly(List<TableEdit> edits) {
        for (TableEdit edit : edits) {
            if (!(edit instanceof TableEdit.AddColumn add) || add.setValue() != null || !isNativelyAddable(add.column())) {
                return false;
            }
        }
        return true;
    }

    /**
     * SQLite refuses ADD COLUMN for PRIMARY KEY or UNIQUE columns, NOT NULL columns without a
     * default, and non-constant defaults.
     */
    boolean isNativelyAddable(ColumnModel column) {
        if (column.hasConstraintKeyword("PRIMARY KEY") || column.isUnique()) {
            return false;
        }
        var defaultValue = column.findDefaultValue();
        if (column.isNotNull() && defaultValue.isEmpty()) {
            return false;
        }
        return defaultValue
                .map(v -> !v.startsWith("(") && !v.toUpperCase(java.util.Locale.ROOT).startsWith("CURRENT_"))
                .orElse(true);
    }

    private AlterTableResult compileAdditive(TableModel table, List<TableEdit> edits, List<IndexModel> indexes) {
        TableModel altered = table;
        List<MigrationOperation> operations = new ArrayList<>();
        for (TableEdit edit : edits) {
            ColumnModel column = ((TableEdit.AddColumn) edit).column();
            altered = altered.addingColumn(column);
            operations.add(new AddColumnOperation(table.getName(), column));
        }
        log.debug("Table '{}': {} column(s) appended with ADD COLUMN", table.getName(), operations.size());
        return new AlterTableResult(altered.validate(), indexes, List.of(), operations);
    }

    private AlterTableResult compileRebuild(TableModel table, List<TableEdit> edits, List<IndexModel> indexes,
                                            Set<String> occupiedNames) {
        Working working = new Working(table);
        for (TableEdit edit : edits) {
            working.apply(edit);
        }

        TableModel finalTable = working.toTable().validate();
        List<ColumnSource> plan = working.columnPlan();
        IndexRemapper.Result remapped = indexRemapper.remap(indexes, table.getName(), working.columnMapping());

        String temporaryName = temporaryName(table.getName(), occupiedNames);
        RebuildTableOperation rebuild = new RebuildTableOperation(
                table.getName(), temporaryName, finalTable, plan, remapped.kept());

        log.debug("Table '{}': {} edit(s) collapsed into one rebuild via '{}'", table.getName(), edits.size(), temporaryName);
        return new AlterTableResult(finalTable, remapped.kept(), remapped.dropped(), List.of(rebuild));
    }

    static String temporaryName(String tableName, Set<String> occupiedNames) {
        String base = tableName + TEMPORARY_SUFFIX;
        String candidate = base;
        int n = 2;
        while (occupiedNames.contains(candidate)) {
            candidate = base + "_" + n++;
        }
        return candidate;
    }

    private static final class WorkingColumn {
        private ColumnModel column;
        private final String sourceName; // 원본 테이블에서의 이름, 새 컬럼이면 null
        private String expression;

        private WorkingColumn(ColumnModel column, String sourceName, String expression) {
            this.column = column;
            this.sourceName = sourceName;
            this.expression = expression;
        }

        private String name() {
            return column.getName();
        }
    }

    /**
     * The table being edited, with each column's origin tracked so the data copy can be
     * generated once at the end.
     */
    private static final class Working {
        private final String tableName;
        private final List<WorkingColumn> columns = new ArrayList<>();
        private final List<ConstraintModel> constraints;
        private PrimaryKeyModel primaryKey;

        private Working(TableModel table) {
            this.tableName = table.getName();
            for (ColumnModel c : table.getColumns()) {
                columns.add(new WorkingColumn(c, c.getName(), null));
            }
            this.constraints = new ArrayList<>(table.getConstraints());
            this.primaryKey = table.getPrimaryKey();
        }

        private void apply(TableEdit edit) {
            if (edit instanceof TableEdit.AddColumn add) {
                addColumn(add);
            } else if (edit instanceof TableEdit.AlterColumn alter) {
                alterColumn(alter);
            } else if (edit instanceof TableEdit.DropColumn drop) {
                dropColumn(drop.columnName());
            } else if (edit instanceof TableEdit.AddConstraint add) {
                addConstraint(add.constraint());
            } else if (edit instanceof TableEdit.DropConstraint drop) {
                dropConstraint(drop);
            } else if (edit instanceof TableEdit.DropAllConstraints) {
                constraints.clear();
            } else {
                throw new IllegalArgumentException("Unsupported table edit: " + edit);
            }
        }

        private void addColumn(TableEdit.AddColumn add) {
            String name = add.column().getName();
            if (find(name) != null) {
                throw new SchemaDeclarationException("Unable to add '" + name + "' column to '" + tableName
                        + "': column already exists.");
            }
            columns.add(new WorkingColumn(add.column(), null, add.setValue()));
        }

        private void alterColumn(TableEdit.AlterColumn alter) {
            WorkingColumn wc = resolve(alter.columnName());
            ColumnModel altered = wc.column;
            if (alter.renameTo() != null && !alter.renameTo().equals(wc.name())) {
                if (find(alter.renameTo()) != null) {
                    throw new SchemaDeclarationException("Unable to rename '" + wc.name() + "' in '" + tableName
                            + "': column '" + alter.renameTo() + "' already exists.");
                }
                if (primaryKey != null && primaryKey.getColumnName().equals(wc.name())) {
                    primaryKey = primaryKey.withColumnName(alter.renameTo());
                }
                altered = altered.renamedTo(alter.renameTo());
            }
            if (alter.changeTypeTo() != null) {
                altered = altered.withType(alter.changeTypeTo());
            }
            if (alter.constraints() != null) {
                altered = altered.withConstraints(alter.constraints());
            }
            wc.column = altered;
            if (alter.setValue() != null) {
                wc.expression = alter.setValue();
            }
        }

        private void dropColumn(String columnName) {
            WorkingColumn wc = resolve(columnName);
            columns.remove(wc);
            if (primaryKey != null && primaryKey.getColumnName().equals(wc.name())) {
                primaryKey = null;
            }
        }

        private void addConstraint(ConstraintModel constraint) {
            if (constraint.isNamed() && constraints.stream().anyMatch(c -> constraint.getName().equals(c.getName()))) {
                throw new SchemaDeclarationException("Unable to add constraint to '" + tableName + "': '"
                        + constraint.getName() + "' constraint already exists.");
            }
            constraints.add(constraint);
        }

        private void dropConstraint(TableEdit.DropConstraint drop) {
            boolean removed = drop.name() != null
                    ? constraints.removeIf(c -> drop.name().equals(c.getName()))
                    : constraints.removeIf(c -> Objects.equals(drop.definition(), c.getDefinition()));
            if (!removed) {
                String what = drop.name() != null ? drop.name() : drop.definition();
                throw new SchemaDeclarationException("Unable to drop constraint from '" + tableName + "': '"
                        + what + "' constraint not found.");
            }
        }

        private WorkingColumn find(String name) {
            for (WorkingColumn wc : columns) {
                if (wc.name().equals(name)) {
                    return wc;
                }
            }
            return null;
        }

        /**
         * Current name first; otherwise a renamed column addressed by its pre-edit name.
         */
        private WorkingColumn resolve(String name) {
            WorkingColumn byCurrent = find(name);
            if (byCurrent != null) {
                return byCurrent;
            }
            for (WorkingColumn wc : columns) {
                if (name.equals(wc.sourceName)) {
                    return wc;
                }
            }
            throw new SchemaDeclarationException("Unable to alter table '" + tableName + "': column '" + name
                    + "' doesn't exist.");
        }

        private TableModel toTable() {
            return TableModel.builder()
                    .name(tableName)
                    .columns(columns.stream().map(wc -> wc.column).toList())
                    .constraints(constraints)
                    .primaryKey(primaryKey)
                    .build();
        }

        private List<ColumnSource> columnPlan() {
            List<ColumnSource> plan = new ArrayList<>();
            for (WorkingColumn wc : columns) {
                if (wc.expression != null) {
                    plan.add(ColumnSource.expression(wc.name(), wc.expression));
                } else if (wc.sourceName != null) {
                    plan.add(ColumnSource.carry(wc.name(), wc.sourceName));
                }
            }
            return plan;
        }

        private Map<String, String> columnMapping() {
            Map<String, String> mapping = new LinkedHashMap<>();
            for (WorkingColumn wc : columns) {
                if (wc.sourceName != null) {
                    mapping.put(wc.sourceName, wc.name());
                }
            }
            return mapping;
        }
    }
}
