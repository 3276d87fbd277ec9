package org.shale.schema;

import org.shale.migration.compiler.TableEdit;
import org.shale.model.ColumnModel;
import org.shale.model.ColumnType;
import org.shale.model.ConstraintModel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Collects the edits of an {@code alterTable} block in declaration order.
 */
public class TableAlterer {
    private final String tableName;
    private final List<Supplier<TableEdit>> edits = new ArrayList<>();

    TableAlterer(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }

    public TableAlterer addColumn(String name, ColumnType type, String... constraints) {
        return addColumn(name, type, Arrays.asList(constraints), null);
    }

    /**
     * @param setValue SQL expression over the old row filling the column for existing rows, or
     *                 null to use the column default
     */
    public TableAlterer addColumn(String name, ColumnType type, List<String> constraints, String setValue) {
        TableEdit edit = new TableEdit.AddColumn(ColumnModel.of(name, type, constraints), setValue);
        edits.add(() -> edit);
        return this;
    }

    public ColumnAlteration alterColumn(String name) {
        ColumnAlteration alteration = new ColumnAlteration(name);
        edits.add(alteration::toEdit);
        return alteration;
    }

    public TableAlterer alterColumn(String name, Consumer<ColumnAlteration> block) {
        block.accept(alterColumn(name));
        return this;
    }

    public TableAlterer dropColumn(String name) {
        TableEdit edit = new TableEdit.DropColumn(name);
        edits.add(() -> edit);
        return this;
    }

    public TableAlterer addConstraint(String definition) {
        TableEdit edit = new TableEdit.AddConstraint(ConstraintModel.of(definition));
        edits.add(() -> edit);
        return this;
    }

    public TableAlterer addConstraint(String name, String definition) {
        TableEdit edit = new TableEdit.AddConstraint(ConstraintModel.named(name, definition));
        edits.add(() -> edit);
        return this;
    }

    public TableAlterer dropConstraint(String definition) {
        TableEdit edit = new TableEdit.DropConstraint(null, definition);
        edits.add(() -> edit);
        return this;
    }

    public TableAlterer dropConstraintNamed(String name) {
        TableEdit edit = new TableEdit.DropConstraint(name, null);
        edits.add(() -> edit);
        return this;
    }

    public TableAlterer dropAllConstraints() {
        TableEdit edit = new TableEdit.DropAllConstraints();
        edits.add(() -> edit);
        return this;
    }

    List<TableEdit> edits() {
        return edits.stream().map(Supplier::get).toList();
    }
}
