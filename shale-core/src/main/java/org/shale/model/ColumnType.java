package org.shale.model;

/**
 * Storage affinity of a column. {@link #NULL} declares no type at all.
 */
public enum ColumnType {
    INTEGER("INTEGER"),
    REAL("REAL"),
    TEXT("TEXT"),
    BLOB("BLOB"),
    NULL("");

    private final String sqlKeyword;

    ColumnType(String sqlKeyword) {
        this.sqlKeyword = sqlKeyword;
    }

    public String getSqlKeyword() {
        return sqlKeyword;
    }

    public static ColumnType fromSql(String raw) {
        if (raw == null || raw.isBlank()) {
            return NULL;
        }
        String normalized = raw.trim().toUpperCase(java.util.Locale.ROOT);
        for (ColumnType type : values()) {
            if (type != NULL && type.sqlKeyword.equals(normalized)) {
                return type;
            }
        }
        if (normalized.equals("NULL") || normalized.equals("NONE")) {
            return NULL;
        }
        throw new IllegalArgumentException("Unsupported column type: " + raw);
    }
}
