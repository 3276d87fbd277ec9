package org.shale.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.shale.exception.SchemaDeclarationException;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A table at one schema version. Column order is the physical order used for CREATE TABLE and
 * for the column lists of data copies.
 */
@Value
@Builder(toBuilder = true)
public class TableModel {
    String name;
    @Singular List<ColumnModel> columns;
    @Singular List<ConstraintModel> constraints;
    PrimaryKeyModel primaryKey; // optional

    @JsonIgnore
    public List<String> getColumnNames() {
        return columns.stream().map(ColumnModel::getName).toList();
    }

    public Optional<ColumnModel> column(String columnName) {
        return columns.stream().filter(c -> c.getName().equals(columnName)).findFirst();
    }

    public boolean hasColumn(String columnName) {
        return column(columnName).isPresent();
    }

    public Optional<ConstraintModel> constraintNamed(String constraintName) {
        return constraints.stream()
                .filter(c -> constraintName.equals(c.getName()))
                .findFirst();
    }

    public Optional<PrimaryKeyModel> primaryKey() {
        return Optional.ofNullable(primaryKey);
    }

    public TableModel withName(String newName) {
        return toBuilder().name(newName).build();
    }

    public TableModel addingColumn(ColumnModel column) {
        if (hasColumn(column.getName())) {
            throw new SchemaDeclarationException("Unable to add '" + column.getName() + "' column to '"
                    + name + "': column already exists.");
        }
        return toBuilder().column(column).build();
    }

    /**
     * Checks the structural invariants: unique column names, unique constraint names and a
     * primary key that refers to an existing column.
     *
     * @return this table
     * @throws SchemaDeclarationException when an invariant does not hold
     */
    public TableModel validate() {
        if (name == null || name.isBlank()) {
            throw new SchemaDeclarationException("Table name must not be blank");
        }
        if (columns.isEmpty()) {
            throw new SchemaDeclarationException("Table '" + name + "' must declare at least one column");
        }
        Set<String> seen = new HashSet<>();
        for (ColumnModel c : columns) {
            if (c.getName() == null || c.getName().isBlank()) {
                throw new SchemaDeclarationException("Table '" + name + "' declares a column without a name");
            }
            if (!seen.add(c.getName())) {
                throw new SchemaDeclarationException("Table '" + name + "' declares column '" + c.getName() + "' twice");
            }
        }
        Set<String> constraintNames = new HashSet<>();
        for (ConstraintModel c : constraints) {
            if (c.isNamed() && !constraintNames.add(c.getName())) {
                throw new SchemaDeclarationException("Table '" + name + "' declares constraint '" + c.getName() + "' twice");
            }
        }
        if (primaryKey != null && !hasColumn(primaryKey.getColumnName())) {
            throw new SchemaDeclarationException("Primary key of '" + name + "' refers to unknown column '"
                    + primaryKey.getColumnName() + "'");
        }
        return this;
    }
}
