package org.shale.migration.contributor.create;

import org.shale.migration.contributor.DdlContributor;
import org.shale.migration.spi.dialect.DdlDialect;
import org.shale.model.ColumnModel;
import org.shale.model.PrimaryKeyModel;

import java.util.List;

public record ColumnContributor(PrimaryKeyModel primaryKey, List<ColumnModel> columns) implements DdlContributor {
    @Override
    public int priority() {
        return 40; // 컬럼 정의
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (ColumnModel c : columns) {
            PrimaryKeyModel pk = primaryKey != null && primaryKey.getColumnName().equals(c.getName()) ? primaryKey : null;
            sb.append("  ").append(dialect.getColumnDefinitionSql(c, pk)).append(",\n");
        }
    }
}
