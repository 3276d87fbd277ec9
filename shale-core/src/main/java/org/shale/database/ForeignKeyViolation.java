package org.shale.database;

import lombok.Builder;
import lombok.Value;

/**
 * One row of {@code PRAGMA foreign_key_check}: a row of {@code tableName} whose reference into
 * {@code parentTableName} cannot be resolved.
 */
@Value
@Builder
public class ForeignKeyViolation {
    String tableName;
    Long rowId; // WITHOUT ROWID 테이블이면 null
    String parentTableName;
    int foreignKeyIndex;
}
