package org.shale.migration.contributor.create;

import org.shale.migration.contributor.StatementContributor;
import org.shale.migration.spi.dialect.DdlDialect;
import org.shale.model.IndexModel;

import java.util.List;

public record IndexContributor(List<IndexModel> indexes) implements StatementContributor {
    @Override
    public int priority() {
        return 60; // 인덱스는 테이블이 제자리에 놓인 뒤
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect) {
        for (IndexModel idx : indexes) {
            statements.add(dialect.indexStatement(idx, false));
        }
    }
}
