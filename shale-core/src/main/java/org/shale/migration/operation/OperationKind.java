package org.shale.migration.operation;

public enum OperationKind {
    CREATE_TABLE,
    DROP_TABLE,
    RENAME_TABLE,
    ADD_COLUMN,
    REBUILD_TABLE,
    CREATE_INDEX,
    DROP_INDEX,
    RENAME_INDEX,
    EXECUTE
}
