package org.shale.migration;

import org.shale.migration.contributor.DdlContributor;
import org.shale.migration.contributor.create.ColumnContributor;
import org.shale.migration.contributor.create.ConstraintContributor;
import org.shale.migration.spi.dialect.DdlDialect;
import org.shale.model.TableModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class CreateTableBuilder {
    private final String table;
    private final DdlDialect dialect;
    private final List<DdlContributor> body = new ArrayList<>();

    public CreateTableBuilder(String table, DdlDialect dialect) {
        this.table = table;
        this.dialect = dialect;
    }

    public CreateTableBuilder add(DdlContributor c) {
        body.add(c);
        return this;
    }

    public String build() {
        StringBuilder sb = new StringBuilder(dialect.openCreateTable(table));

        body.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        trimTrailingComma(sb);

        sb.append(dialect.closeCreateTable());
        return sb.toString();
    }

    private void trimTrailingComma(StringBuilder sb) {
        int last = sb.lastIndexOf(",\n");
        if (last != -1 && last == sb.length() - 2) sb.delete(last, last + 2);
    }

    /**
     * Adds the columns (with the inline primary key) and the table constraints of {@code source}.
     * The statement keeps the builder's table name, so a table can be created under another name.
     */
    public CreateTableBuilder defaultsFrom(TableModel source) {
        this.add(new ColumnContributor(source.getPrimaryKey(), source.getColumns()));
        this.add(new ConstraintContributor(source.getConstraints()));
        return this;
    }
}
