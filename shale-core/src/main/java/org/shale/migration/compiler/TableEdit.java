package org.shale.migration.compiler;

import org.shale.model.ColumnModel;
import org.shale.model.ColumnType;
import org.shale.model.ConstraintModel;

import java.util.List;

/**
 * A single change requested inside an {@code alterTable} block. Edits are applied in
 * declaration order.
 */
public interface TableEdit {

    record AddColumn(ColumnModel column, String setValue) implements TableEdit {
    }

    /**
     * Null fields leave the corresponding property unchanged. {@code constraints} replaces the
     * column's constraints wholesale.
     */
    record AlterColumn(String columnName,
                       String renameTo,
                       ColumnType changeTypeTo,
                       List<String> constraints,
                       String setValue) implements TableEdit {
    }

    record DropColumn(String columnName) implements TableEdit {
    }

    record AddConstraint(ConstraintModel constraint) implements TableEdit {
    }

    /**
     * Removes a table constraint by name, or by its definition text when {@code name} is null.
     */
    record DropConstraint(String name, String definition) implements TableEdit {
    }

    record DropAllConstraints() implements TableEdit {
    }
}
