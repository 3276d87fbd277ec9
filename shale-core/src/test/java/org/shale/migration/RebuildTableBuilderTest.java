package org.shale.migration;

import org.junit.jupiter.api.Test;
import org.shale.migration.contributor.alter.TableRenameContributor;
import org.shale.migration.contributor.drop.DropTableStatementContributor;
import org.shale.migration.dialect.sqlite.SqliteDialect;
import org.shale.migration.operation.RebuildTableOperation;
import org.shale.model.ColumnModel;
import org.shale.model.ColumnType;
import org.shale.model.TableModel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RebuildTableBuilderTest {

    private final SqliteDialect dialect = new SqliteDialect();

    @Test
    void unitsRunInPriorityOrderRegardlessOfInsertion() {
        List<String> sql = new RebuildTableBuilder("t", dialect)
                .add(new TableRenameContributor("t_tmp", "t"))
                .add(new DropTableStatementContributor("t", false))
                .build();

        assertThat(sql).containsExactly("DROP TABLE \"t\"", "ALTER TABLE \"t_tmp\" RENAME TO \"t\"");
    }

    @Test
    void defaultsFrom_registersFiveUnits() {
        TableModel finalTable = TableModel.builder()
                .name("t")
                .column(ColumnModel.of("a", ColumnType.INTEGER, List.of()))
                .build();
        RebuildTableOperation op = new RebuildTableOperation("t", "t_shale_tmp", finalTable, List.of(), List.of());

        RebuildTableBuilder builder = new RebuildTableBuilder("t", dialect).defaultsFrom(op);

        assertThat(builder.getUnits()).hasSize(5);
        // 인덱스가 없으면 네 문장
        assertThat(builder.build()).hasSize(4);
    }
}
