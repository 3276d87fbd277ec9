package org.shale.migration.contributor.drop;

import org.shale.migration.contributor.StatementContributor;
import org.shale.migration.spi.dialect.DdlDialect;

import java.util.List;

public record DropTableStatementContributor(String tableName, boolean ifExists) implements StatementContributor {
    @Override
    public int priority() {
        return 30;
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(dialect.getDropTableSql(tableName, ifExists));
    }
}
