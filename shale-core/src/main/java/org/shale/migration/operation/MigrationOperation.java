package org.shale.migration.operation;

import org.shale.migration.spi.visitor.MigrationVisitor;

/**
 * One engine-executable migration step. Versions are compiled into ordered lists of these.
 */
public interface MigrationOperation {

    OperationKind kind();

    /**
     * Name of the table or index the operation works on, for diagnostics.
     */
    String target();

    void accept(MigrationVisitor visitor);
}
