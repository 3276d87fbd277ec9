package org.shale.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PrimaryKeyModel {
    String columnName;
    boolean autoincrement;

    public static PrimaryKeyModel of(String columnName, boolean autoincrement) {
        return new PrimaryKeyModel(columnName, autoincrement);
    }

    public PrimaryKeyModel withColumnName(String newColumnName) {
        return new PrimaryKeyModel(newColumnName, autoincrement);
    }
}
