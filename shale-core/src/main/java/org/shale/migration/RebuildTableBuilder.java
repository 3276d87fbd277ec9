package org.shale.migration;

import lombok.Getter;
import org.shale.migration.contributor.StatementContributor;
import org.shale.migration.contributor.alter.DataCopyContributor;
import org.shale.migration.contributor.alter.TableRenameContributor;
import org.shale.migration.contributor.alter.TemporaryTableContributor;
import org.shale.migration.contributor.create.IndexContributor;
import org.shale.migration.contributor.drop.DropTableStatementContributor;
import org.shale.migration.operation.RebuildTableOperation;
import org.shale.migration.spi.dialect.DdlDialect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Assembles the statements of a table rebuild in contributor priority order.
 */
public class RebuildTableBuilder {
    @Getter
    private final String tableName;
    @Getter
    private final DdlDialect dialect;
    @Getter
    private final List<StatementContributor> units = new ArrayList<>();

    public RebuildTableBuilder(String tableName, DdlDialect dialect) {
        this.tableName = tableName;
        this.dialect = dialect;
    }

    public RebuildTableBuilder add(StatementContributor unit) {
        units.add(unit);
        return this;
    }

    public List<String> build() {
        List<String> statements = new ArrayList<>();
        units.stream()
                .sorted(Comparator.comparingInt(StatementContributor::priority))
                .forEach(c -> c.contribute(statements, dialect));
        return statements;
    }

    public RebuildTableBuilder defaultsFrom(RebuildTableOperation op) {
        this.add(new TemporaryTableContributor(op.temporaryName(), op.finalTable()));
        this.add(new DataCopyContributor(op.temporaryName(), op.originalName(), op.columnPlan()));
        this.add(new DropTableStatementContributor(op.originalName(), false));
        this.add(new TableRenameContributor(op.temporaryName(), op.originalName()));
        this.add(new IndexContributor(op.indexesToRecreate()));
        return this;
    }
}
