package org.shale.schema;

import org.shale.migration.compiler.TableEdit;
import org.shale.model.ColumnType;

import java.util.Arrays;
import java.util.List;

/**
 * Changes to one existing column inside an {@code alterTable} block. Properties left unset keep
 * their current value.
 */
public class ColumnAlteration {
    private final String columnName;
    private String renameTo;
    private ColumnType changeTypeTo;
    private List<String> constraints;
    private String setValue;

    ColumnAlteration(String columnName) {
        this.columnName = columnName;
    }

    public ColumnAlteration renameTo(String newName) {
        this.renameTo = newName;
        return this;
    }

    public ColumnAlteration changeTypeTo(ColumnType newType) {
        this.changeTypeTo = newType;
        return this;
    }

    /**
     * Replaces every constraint of the column.
     */
    public ColumnAlteration setConstraints(String... newConstraints) {
        return setConstraints(Arrays.asList(newConstraints));
    }

    public ColumnAlteration setConstraints(List<String> newConstraints) {
        this.constraints = List.copyOf(newConstraints);
        return this;
    }

    /**
     * Computes the column from a SQL expression over the old row while the table is rebuilt.
     * Columns in the expression use their names from before the block.
     */
    public ColumnAlteration setValue(String expression) {
        this.setValue = expression;
        return this;
    }

    TableEdit toEdit() {
        return new TableEdit.AlterColumn(columnName, renameTo, changeTypeTo, constraints, setValue);
    }
}
