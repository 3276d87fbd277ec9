package org.shale.schema;

import org.shale.exception.SchemaDeclarationException;
import org.shale.model.ColumnModel;
import org.shale.model.ColumnType;
import org.shale.model.ConstraintModel;
import org.shale.model.PrimaryKeyModel;
import org.shale.model.TableModel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Collects the columns and constraints of a {@code createTable} block.
 */
public class TableBuilder {
    private final String name;
    private final List<ColumnModel> columns = new ArrayList<>();
    private final List<ConstraintModel> constraints = new ArrayList<>();
    private PrimaryKeyModel primaryKey;

    TableBuilder(String name) {
        this.name = name;
    }

    /**
     * Adds an {@code INTEGER PRIMARY KEY} column.
     */
    public TableBuilder primaryKey(String columnName) {
        return primaryKey(columnName, false);
    }

    public TableBuilder primaryKey(String columnName, boolean autoincrement) {
        if (primaryKey != null) {
            throw new SchemaDeclarationException("Table '" + name + "' already has primary key '"
                    + primaryKey.getColumnName() + "'");
        }
        primaryKey = PrimaryKeyModel.of(columnName, autoincrement);
        columns.add(ColumnModel.of(columnName, ColumnType.INTEGER, List.of()));
        return this;
    }

    public TableBuilder column(String columnName, ColumnType type, String... constraints) {
        return column(columnName, type, Arrays.asList(constraints));
    }

    public TableBuilder column(String columnName, ColumnType type, List<String> constraints) {
        columns.add(ColumnModel.of(columnName, type, constraints));
        return this;
    }

    public TableBuilder constraint(String definition) {
        constraints.add(ConstraintModel.of(definition));
        return this;
    }

    public TableBuilder constraint(String constraintName, String definition) {
        constraints.add(ConstraintModel.named(constraintName, definition));
        return this;
    }

    TableModel build() {
        return TableModel.builder()
                .name(name)
                .columns(columns)
                .constraints(constraints)
                .primaryKey(primaryKey)
                .build()
                .validate();
    }
}
