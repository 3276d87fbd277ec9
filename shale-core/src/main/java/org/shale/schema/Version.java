package org.shale.schema;

import org.shale.migration.operation.MigrationOperation;
import org.shale.model.SchemaSnapshot;

import java.util.List;

/**
 * One compiled schema version: the snapshot it produces and the operations that take a
 * database from the previous version to it.
 */
public record Version(int number, SchemaSnapshot snapshot, List<MigrationOperation> operations) {

    public Version {
        operations = List.copyOf(operations);
    }
}
