package org.shale.schema;

import org.shale.model.IndexModel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class IndexBuilder {
    private final String name;
    private final String tableName;
    private final List<String> columns = new ArrayList<>();
    private boolean unique;
    private String where;
    private boolean ifNotExists;

    IndexBuilder(String name, String tableName) {
        this.name = name;
        this.tableName = tableName;
    }

    public IndexBuilder columns(String... columnNames) {
        columns.addAll(Arrays.asList(columnNames));
        return this;
    }

    public IndexBuilder unique() {
        this.unique = true;
        return this;
    }

    /**
     * Makes this a partial index. The expression is kept as written, also when the table is
     * later rebuilt with renamed columns.
     */
    public IndexBuilder where(String expression) {
        this.where = expression;
        return this;
    }

    public IndexBuilder ifNotExists() {
        this.ifNotExists = true;
        return this;
    }

    boolean isIfNotExists() {
        return ifNotExists;
    }

    IndexModel build() {
        return IndexModel.builder()
                .name(name)
                .tableName(tableName)
                .columns(columns)
                .unique(unique)
                .where(where)
                .build();
    }
}
