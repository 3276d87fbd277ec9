package org.shale.migration.contributor.alter;

import org.shale.migration.CreateTableBuilder;
import org.shale.migration.contributor.StatementContributor;
import org.shale.migration.spi.dialect.DdlDialect;
import org.shale.model.TableModel;

import java.util.List;

public record TemporaryTableContributor(String temporaryName, TableModel finalTable) implements StatementContributor {
    @Override
    public int priority() {
        return 10; // 임시 테이블 생성이 가장 먼저
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        statements.add(new CreateTableBuilder(temporaryName, dialect)
                .defaultsFrom(finalTable)
                .build());
    }
}
