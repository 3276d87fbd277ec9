package org.shale.migration.contributor.create;

import org.shale.migration.contributor.DdlContributor;
import org.shale.migration.spi.dialect.DdlDialect;
import org.shale.model.ConstraintModel;

import java.util.List;

public record ConstraintContributor(List<ConstraintModel> constraints) implements DdlContributor {
    @Override
    public int priority() {
        return 60; // 테이블 제약조건은 컬럼 뒤에
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (ConstraintModel cons : constraints) {
            if (cons.getDefinition() == null || cons.getDefinition().isBlank()) {
                throw new IllegalStateException("Constraint definition must not be empty: " + cons);
            }
            sb.append("  ").append(dialect.getConstraintDefinitionSql(cons)).append(",\n");
        }
    }
}
