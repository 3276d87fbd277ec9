package org.shale.migration.contributor.alter;

import org.shale.migration.contributor.StatementContributor;
import org.shale.migration.operation.ColumnSource;
import org.shale.migration.spi.dialect.DdlDialect;

import java.util.List;

public record DataCopyContributor(String temporaryName, String originalName, List<ColumnSource> columnPlan)
        implements StatementContributor {
    @Override
    public int priority() {
        return 20;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getCopyDataSql(temporaryName, originalName, columnPlan));
    }
}
