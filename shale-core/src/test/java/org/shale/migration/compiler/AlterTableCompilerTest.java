package org.shale.migration.compiler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.shale.exception.SchemaDeclarationException;
import org.shale.migration.operation.AddColumnOperation;
import org.shale.migration.operation.ColumnSource;
import org.shale.migration.operation.RebuildTableOperation;
import org.shale.model.ColumnModel;
import org.shale.model.ColumnType;
import org.shale.model.ConstraintModel;
import org.shale.model.IndexModel;
import org.shale.model.PrimaryKeyModel;
import org.shale.model.TableModel;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlterTableCompilerTest {

    private AlterTableCompiler compiler;
    private TableModel people;
    private IndexModel namesIndex;

    @BeforeEach
    void setUp() {
        compiler = new AlterTableCompiler();
        people = TableModel.builder()
                .name("people")
                .column(ColumnModel.of("id", ColumnType.INTEGER, List.of()))
                .column(ColumnModel.of("name", ColumnType.TEXT, List.of("NOT NULL")))
                .column(ColumnModel.of("age", ColumnType.INTEGER, List.of()))
                .constraint(ConstraintModel.named("adult", "CHECK (age >= 18)"))
                .primaryKey(PrimaryKeyModel.of("id", false))
                .build();
        namesIndex = IndexModel.builder().name("people_names").tableName("people").column("name").unique(true).build();
    }

    private AlterTableResult compile(TableEdit... edits) {
        return compiler.compile(people, List.of(edits), List.of(namesIndex), Set.of("people"));
    }

    private static RebuildTableOperation onlyRebuild(AlterTableResult result) {
        assertThat(result.operations()).hasSize(1);
        assertThat(result.operations().get(0)).isInstanceOf(RebuildTableOperation.class);
        return (RebuildTableOperation) result.operations().get(0);
    }

    @Nested
    @DisplayName("추가 전용 편집")
    class AdditiveOnly {

        @Test
        @DisplayName("단순 컬럼 추가는 컬럼마다 ADD COLUMN 한 번")
        void plainAddsUseNativeAlter() {
            AlterTableResult result = compile(
                    new TableEdit.AddColumn(ColumnModel.of("email", ColumnType.TEXT, List.of()), null),
                    new TableEdit.AddColumn(ColumnModel.of("score", ColumnType.REAL, List.of("NOT NULL", "DEFAULT 0")), null));

            assertThat(result.operations()).hasSize(2).allMatch(op -> op instanceof AddColumnOperation);
            assertThat(result.table().getColumnNames()).containsExactly("id", "name", "age", "email", "score");
            assertThat(result.indexes()).containsExactly(namesIndex);
        }

        @Test
        @DisplayName("setValue 가 있으면 재구성")
        void setValueForcesRebuild() {
            AlterTableResult result = compile(
                    new TableEdit.AddColumn(ColumnModel.of("email", ColumnType.TEXT, List.of()), "lower(name)"));

            RebuildTableOperation rebuild = onlyRebuild(result);
            assertThat(rebuild.columnPlan()).contains(ColumnSource.expression("email", "lower(name)"));
        }

        @Test
        void columnsNativeAlterCannotAdd() {
            assertThat(compiler.isNativelyAddable(ColumnModel.of("a", ColumnType.TEXT, List.of("UNIQUE")))).isFalse();
            assertThat(compiler.isNativelyAddable(ColumnModel.of("a", ColumnType.TEXT, List.of("NOT NULL")))).isFalse();
            assertThat(compiler.isNativelyAddable(ColumnModel.of("a", ColumnType.TEXT, List.of("DEFAULT CURRENT_TIMESTAMP")))).isFalse();
            assertThat(compiler.isNativelyAddable(ColumnModel.of("a", ColumnType.TEXT, List.of("DEFAULT (1 + 1)")))).isFalse();
            assertThat(compiler.isNativelyAddable(ColumnModel.of("a", ColumnType.TEXT, List.of("NOT NULL DEFAULT 'x'")))).isTrue();
        }
    }

    @Nested
    @DisplayName("재구성")
    class Rebuild {

        @Test
        @DisplayName("이름 변경과 삭제를 한 번의 재구성으로 합친다")
        void renameAndDropCollapseIntoOneRebuild() {
            AlterTableResult result = compile(
                    new TableEdit.AlterColumn("name", "full_name", null, null, null),
                    new TableEdit.DropColumn("age"));

            RebuildTableOperation rebuild = onlyRebuild(result);
            assertThat(rebuild.finalTable().getColumnNames()).containsExactly("id", "full_name");
            assertThat(rebuild.columnPlan()).containsExactly(
                    ColumnSource.carry("id", "id"),
                    ColumnSource.carry("full_name", "name"));
            assertThat(rebuild.temporaryName()).isEqualTo("people_shale_tmp");
        }

        @Test
        @DisplayName("이름을 바꾼 뒤 옛 이름으로도 같은 컬럼을 가리킬 수 있다")
        void editAfterRenameByOldName() {
            AlterTableResult result = compile(
                    new TableEdit.AlterColumn("name", "full_name", null, null, null),
                    new TableEdit.AlterColumn("name", null, ColumnType.BLOB, List.of(), null));

            ColumnModel column = result.table().column("full_name").orElseThrow();
            assertThat(column.getType()).isEqualTo(ColumnType.BLOB);
            assertThat(column.getConstraints()).isEmpty();
        }

        @Test
        @DisplayName("같은 이름의 컬럼을 삭제 후 다시 추가할 수 있다")
        void dropThenAddSameName() {
            AlterTableResult result = compile(
                    new TableEdit.DropColumn("age"),
                    new TableEdit.AddColumn(ColumnModel.of("age", ColumnType.TEXT, List.of()), null));

            RebuildTableOperation rebuild = onlyRebuild(result);
            assertThat(rebuild.finalTable().column("age")).map(ColumnModel::getType).contains(ColumnType.TEXT);
            // 새 컬럼에는 이어받을 값이 없다
            assertThat(rebuild.columnPlan()).extracting(ColumnSource::targetColumn).containsExactly("id", "name");
        }

        @Test
        void laterSetValueReplacesEarlier() {
            AlterTableResult result = compile(
                    new TableEdit.AlterColumn("age", null, null, null, "age + 1"),
                    new TableEdit.AlterColumn("age", null, null, null, "age * 2"));

            assertThat(onlyRebuild(result).columnPlan()).contains(ColumnSource.expression("age", "age * 2"));
        }

        @Test
        void primaryKeyFollowsRenameAndDrop() {
            AlterTableResult renamed = compile(new TableEdit.AlterColumn("id", "person_id", null, null, null));
            AlterTableResult dropped = compile(new TableEdit.DropColumn("id"));

            assertThat(renamed.table().primaryKey()).map(PrimaryKeyModel::getColumnName).contains("person_id");
            assertThat(dropped.table().primaryKey()).isEmpty();
        }

        @Test
        void constraintEdits() {
            AlterTableResult byName = compile(new TableEdit.DropConstraint("adult", null));
            AlterTableResult byDefinition = compile(new TableEdit.DropConstraint(null, "CHECK (age >= 18)"));
            AlterTableResult all = compile(
                    new TableEdit.DropAllConstraints(),
                    new TableEdit.AddConstraint(ConstraintModel.of("CHECK (age > 0)")));

            assertThat(byName.table().getConstraints()).isEmpty();
            assertThat(byDefinition.table().getConstraints()).isEmpty();
            assertThat(all.table().getConstraints()).extracting(ConstraintModel::getDefinition)
                    .containsExactly("CHECK (age > 0)");
            assertThat(all.operations()).hasSize(1);
        }

        @Test
        void temporaryNameAvoidsExistingTables() {
            AlterTableResult result = compiler.compile(people,
                    List.of(new TableEdit.DropColumn("age")),
                    List.of(),
                    Set.of("people", "people_shale_tmp", "people_shale_tmp_2"));

            assertThat(onlyRebuild(result).temporaryName()).isEqualTo("people_shale_tmp_3");
        }
    }

    @Nested
    @DisplayName("인덱스")
    class Indexes {

        @Test
        void indexFollowsRenamedColumn() {
            AlterTableResult result = compile(new TableEdit.AlterColumn("name", "full_name", null, null, null));

            assertThat(result.indexes()).singleElement()
                    .satisfies(i -> assertThat(i.getColumns()).containsExactly("full_name"));
            assertThat(onlyRebuild(result).indexesToRecreate()).hasSize(1);
            assertThat(result.droppedIndexes()).isEmpty();
        }

        @Test
        void indexOnDroppedColumnIsDropped() {
            AlterTableResult result = compile(new TableEdit.DropColumn("name"));

            assertThat(result.indexes()).isEmpty();
            assertThat(result.droppedIndexes()).containsExactly(namesIndex);
            assertThat(onlyRebuild(result).indexesToRecreate()).isEmpty();
        }
    }

    @Nested
    @DisplayName("선언 오류")
    class DeclarationErrors {

        @Test
        void unknownColumn() {
            assertThatThrownBy(() -> compile(new TableEdit.DropColumn("nope")))
                    .isInstanceOf(SchemaDeclarationException.class)
                    .hasMessageContaining("'nope'")
                    .hasMessageContaining("'people'");
        }

        @Test
        void renameOntoExistingColumn() {
            assertThatThrownBy(() -> compile(new TableEdit.AlterColumn("name", "age", null, null, null)))
                    .isInstanceOf(SchemaDeclarationException.class);
        }

        @Test
        void unknownConstraint() {
            assertThatThrownBy(() -> compile(new TableEdit.DropConstraint("missing", null)))
                    .isInstanceOf(SchemaDeclarationException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        void droppingEveryColumn() {
            assertThatThrownBy(() -> compile(
                    new TableEdit.DropColumn("id"), new TableEdit.DropColumn("name"), new TableEdit.DropColumn("age")))
                    .isInstanceOf(SchemaDeclarationException.class);
        }
    }

    @Test
    void noEditsLeaveTableUnchanged() {
        AlterTableResult result = compiler.compile(people, List.of(), List.of(namesIndex), Set.of("people"));

        assertThat(result.table()).isSameAs(people);
        assertThat(result.operations()).isEmpty();
    }
}
