package org.shale.schema;

import org.shale.exception.SchemaDeclarationException;
import org.shale.migration.compiler.AlterTableCompiler;
import org.shale.migration.compiler.AlterTableResult;
import org.shale.migration.compiler.IndexRemapper;
import org.shale.migration.operation.CreateIndexOperation;
import org.shale.migration.operation.CreateTableOperation;
import org.shale.migration.operation.DropIndexOperation;
import org.shale.migration.operation.DropTableOperation;
import org.shale.migration.operation.ExecuteBlock;
import org.shale.migration.operation.ExecuteOperation;
import org.shale.migration.operation.MigrationOperation;
import org.shale.migration.operation.RenameIndexOperation;
import org.shale.migration.operation.RenameTableOperation;
import org.shale.model.IndexModel;
import org.shale.model.SchemaSnapshot;
import org.shale.model.TableModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Declares the changes of one version. Every call edits a working copy of the previous
 * version's snapshot and records the operations that apply the change to a database.
 *
 * <p>Inconsistent declarations (a missing table, a duplicate name, an index over an unknown
 * column) fail with {@link SchemaDeclarationException} at the offending call.
 */
public class VersionBuilder {
    private final int number;
    private final Map<String, TableModel> tables;
    private final Map<String, IndexModel> indexes;
    private final List<MigrationOperation> operations = new ArrayList<>();
    private final AlterTableCompiler alterTableCompiler;
    private final IndexRemapper indexRemapper;

    VersionBuilder(int number, SchemaSnapshot previous, AlterTableCompiler alterTableCompiler, IndexRemapper indexRemapper) {
        this.number = number;
        this.tables = new LinkedHashMap<>(previous.getTables());
        this.indexes = new LinkedHashMap<>(previous.getIndexes());
        this.alterTableCompiler = alterTableCompiler;
        this.indexRemapper = indexRemapper;
    }

    public int getNumber() {
        return number;
    }

    // ---------------------------------------------------------------------------------------------
    // Tables

    public VersionBuilder createTable(String name, Consumer<TableBuilder> block) {
        if (tables.containsKey(name)) {
            throw new SchemaDeclarationException("Unable to create table '" + name + "': table already exists.");
        }
        TableBuilder builder = new TableBuilder(name);
        block.accept(builder);
        TableModel table = builder.build();
        tables.put(name, table);
        operations.add(new CreateTableOperation(table));
        return this;
    }

    public VersionBuilder dropTable(String name) {
        return dropTable(name, false);
    }

    public VersionBuilder dropTable(String name, boolean ifExists) {
        if (!tables.containsKey(name)) {
            if (!ifExists) {
                throw new SchemaDeclarationException("Unable to drop table '" + name + "': table doesn't exist.");
            }
            operations.add(new DropTableOperation(name, true));
            return this;
        }
        for (IndexModel index : indexesOn(name)) {
            indexes.remove(index.getName());
            operations.add(new DropIndexOperation(index.getName(), true));
        }
        tables.remove(name);
        operations.add(new DropTableOperation(name, ifExists));
        return this;
    }

    public VersionBuilder renameTable(String from, String to) {
        TableModel table = requireTable(from, "rename table");
        if (tables.containsKey(to)) {
            throw new SchemaDeclarationException("Unable to rename table '" + from + "' to '" + to
                    + "': table '" + to + "' already exists.");
        }
        List<IndexModel> retargeted = indexRemapper.retarget(indexesOn(from), to);
        replaceTable(from, table.withName(to));
        retargeted.forEach(i -> indexes.put(i.getName(), i));
        operations.add(new RenameTableOperation(from, to));
        return this;
    }

    public VersionBuilder alterTable(String name, Consumer<TableAlterer> block) {
        TableModel table = requireTable(name, "alter table");
        TableAlterer alterer = new TableAlterer(name);
        block.accept(alterer);

        AlterTableResult result = alterTableCompiler.compile(table, alterer.edits(), indexesOn(name), tables.keySet());
        tables.put(name, result.table());
        result.droppedIndexes().forEach(i -> indexes.remove(i.getName()));
        result.indexes().forEach(i -> indexes.put(i.getName(), i));
        operations.addAll(result.operations());
        return this;
    }

    // ---------------------------------------------------------------------------------------------
    // Indexes

    public VersionBuilder createIndex(String name, String tableName, String... columns) {
        return createIndex(name, tableName, i -> i.columns(columns));
    }

    public VersionBuilder createIndex(String name, String tableName, Consumer<IndexBuilder> block) {
        IndexBuilder builder = new IndexBuilder(name, tableName);
        block.accept(builder);
        IndexModel index = builder.build();

        if (indexes.containsKey(name)) {
            if (builder.isIfNotExists()) {
                operations.add(new CreateIndexOperation(index, true));
                return this;
            }
            throw new SchemaDeclarationException("Unable to create index '" + name + "': index already exists.");
        }
        TableModel table = requireTable(tableName, "create index '" + name + "'");
        if (index.getColumns().isEmpty()) {
            throw new SchemaDeclarationException("Unable to create index '" + name + "': no columns given.");
        }
        for (String column : index.getColumns()) {
            if (!table.hasColumn(column)) {
                throw new SchemaDeclarationException("Unable to create index '" + name + "': column '" + column
                        + "' doesn't exist in table '" + tableName + "'.");
            }
        }
        indexes.put(name, index);
        operations.add(new CreateIndexOperation(index, builder.isIfNotExists()));
        return this;
    }

    public VersionBuilder dropIndex(String name) {
        return dropIndex(name, false);
    }

    public VersionBuilder dropIndex(String name, boolean ifExists) {
        if (indexes.remove(name) == null && !ifExists) {
            throw new SchemaDeclarationException("Unable to drop index '" + name + "': index doesn't exist.");
        }
        operations.add(new DropIndexOperation(name, ifExists));
        return this;
    }

    public VersionBuilder renameIndex(String from, String to) {
        IndexModel index = indexes.get(from);
        if (index == null) {
            throw new SchemaDeclarationException("Unable to rename index '" + from + "': index doesn't exist.");
        }
        if (indexes.containsKey(to)) {
            throw new SchemaDeclarationException("Unable to rename index '" + from + "' to '" + to
                    + "': index '" + to + "' already exists.");
        }
        IndexModel renamed = index.renamedTo(to);
        indexes.remove(from);
        indexes.put(to, renamed);
        operations.add(new RenameIndexOperation(from, renamed));
        return this;
    }

    // ---------------------------------------------------------------------------------------------
    // Opaque steps

    public VersionBuilder execute(ExecuteBlock block) {
        return execute("execute #" + (operations.size() + 1), block);
    }

    public VersionBuilder execute(String description, ExecuteBlock block) {
        operations.add(new ExecuteOperation(description, block));
        return this;
    }

    public VersionBuilder executeSql(String sql) {
        return execute(sql, db -> db.execute(sql));
    }

    Version build() {
        return new Version(number, new SchemaSnapshot(tables, indexes), operations);
    }

    private TableModel requireTable(String name, String action) {
        TableModel table = tables.get(name);
        if (table == null) {
            throw new SchemaDeclarationException("Unable to " + action + ": table '" + name + "' doesn't exist.");
        }
        return table;
    }

    private List<IndexModel> indexesOn(String tableName) {
        return indexes.values().stream()
                .filter(i -> i.getTableName().equals(tableName))
                .toList();
    }

    /**
     * Swaps a table under a new key without moving it to the end of the declaration order.
     */
    private void replaceTable(String oldName, TableModel table) {
        Map<String, TableModel> copy = new LinkedHashMap<>(tables);
        tables.clear();
        copy.forEach((name, t) -> tables.put(name.equals(oldName) ? table.getName() : name, name.equals(oldName) ? table : t));
    }
}
