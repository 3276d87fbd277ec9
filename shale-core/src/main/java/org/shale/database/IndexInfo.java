package org.shale.database;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * An explicitly created index as the engine reports it. Automatic indexes backing UNIQUE and
 * PRIMARY KEY constraints are not listed.
 */
@Value
@Builder
public class IndexInfo {
    String name;
    String tableName;
    boolean unique;
    boolean partial;
    @Singular List<String> columns;
}
