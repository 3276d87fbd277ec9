package org.shale.migration.dialect.sqlite;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.shale.migration.operation.ColumnSource;
import org.shale.model.ColumnModel;
import org.shale.model.ColumnType;
import org.shale.model.ConstraintModel;
import org.shale.model.IndexModel;
import org.shale.model.PrimaryKeyModel;
import org.shale.model.TableModel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteDialectTest {

    private final SqliteDialect dialect = new SqliteDialect();

    @Test
    void quoteIdentifier_doublesEmbeddedQuotes() {
        assertThat(dialect.quoteIdentifier("odd\"name")).isEqualTo("\"odd\"\"name\"");
    }

    @Nested
    @DisplayName("테이블")
    class Tables {

        @Test
        void createTable_rendersPrimaryKeyInlineAndConstraintsLast() {
            TableModel people = TableModel.builder()
                    .name("people")
                    .column(ColumnModel.of("id", ColumnType.INTEGER, List.of()))
                    .column(ColumnModel.of("name", ColumnType.TEXT, List.of("NOT NULL")))
                    .column(ColumnModel.of("misc", ColumnType.NULL, List.of()))
                    .constraint(ConstraintModel.named("uq", "UNIQUE (name)"))
                    .constraint(ConstraintModel.of("CHECK (length(name) > 0)"))
                    .primaryKey(PrimaryKeyModel.of("id", true))
                    .build();

            assertThat(dialect.getCreateTableSql(people)).isEqualTo("""
                    CREATE TABLE "people" (
                      "id" INTEGER PRIMARY KEY AUTOINCREMENT,
                      "name" TEXT NOT NULL,
                      "misc",
                      CONSTRAINT "uq" UNIQUE (name),
                      CHECK (length(name) > 0)
                    )""");
        }

        @Test
        void dropAndRename() {
            assertThat(dialect.getDropTableSql("people", false)).isEqualTo("DROP TABLE \"people\"");
            assertThat(dialect.getDropTableSql("people", true)).isEqualTo("DROP TABLE IF EXISTS \"people\"");
            assertThat(dialect.getRenameTableSql("people", "persons"))
                    .isEqualTo("ALTER TABLE \"people\" RENAME TO \"persons\"");
        }

        @Test
        void addColumn() {
            ColumnModel email = ColumnModel.of("email", ColumnType.TEXT, List.of("DEFAULT ''"));

            assertThat(dialect.getAddColumnSql("people", email))
                    .isEqualTo("ALTER TABLE \"people\" ADD COLUMN \"email\" TEXT DEFAULT ''");
        }
    }

    @Nested
    @DisplayName("데이터 복사")
    class CopyData {

        @Test
        @DisplayName("이어받는 컬럼은 인용하고 식은 그대로 둔다")
        void carriedColumnsAndExpressions() {
            List<ColumnSource> plan = List.of(
                    ColumnSource.carry("id", "id"),
                    ColumnSource.carry("full_name", "name"),
                    ColumnSource.expression("email", "lower(name) || '@x.com'"));

            assertThat(dialect.getCopyDataSql("people_shale_tmp", "people", plan)).isEqualTo(
                    "INSERT INTO \"people_shale_tmp\" (\"id\", \"full_name\", \"email\") "
                            + "SELECT \"id\", \"name\", lower(name) || '@x.com' FROM \"people\"");
        }

        @Test
        @DisplayName("빈 계획이어도 행 수는 보존한다")
        void emptyPlanKeepsRows() {
            assertThat(dialect.getCopyDataSql("t_tmp", "t", List.of()))
                    .isEqualTo("INSERT INTO \"t_tmp\" (rowid) SELECT rowid FROM \"t\"");
        }
    }

    @Nested
    @DisplayName("인덱스")
    class Indexes {

        @Test
        void uniquePartialIndex() {
            IndexModel idx = IndexModel.builder()
                    .name("people_names").tableName("people")
                    .column("last").column("first")
                    .unique(true).where("last IS NOT NULL")
                    .build();

            assertThat(dialect.indexStatement(idx, true)).isEqualTo(
                    "CREATE UNIQUE INDEX IF NOT EXISTS \"people_names\" ON \"people\" (\"last\", \"first\") WHERE last IS NOT NULL");
        }

        @Test
        void plainIndexAndDrop() {
            IndexModel idx = IndexModel.builder().name("by_email").tableName("people").column("email").build();

            assertThat(dialect.indexStatement(idx, false)).isEqualTo("CREATE INDEX \"by_email\" ON \"people\" (\"email\")");
            assertThat(dialect.getDropIndexSql("by_email", true)).isEqualTo("DROP INDEX IF EXISTS \"by_email\"");
        }
    }
}
