package org.shale.database;

import lombok.Builder;
import lombok.Value;

/**
 * One row of {@code PRAGMA table_info}.
 */
@Value
@Builder
public class ColumnInfo {
    int position;
    String name;
    String declaredType;
    boolean notNull;
    String defaultValue;
    int primaryKeyPosition; // 0 이면 PK 아님
}
