package org.shale.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnTypeTest {

    @ParameterizedTest
    @CsvSource({
            "integer, INTEGER",
            "REAL, REAL",
            " Text , TEXT",
            "blob, BLOB",
            "NONE, NULL",
            "null, NULL"
    })
    void fromSql_parsesKnownTypes(String raw, ColumnType expected) {
        assertThat(ColumnType.fromSql(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"VARCHAR(20)", "BOOLEAN"})
    void fromSql_rejectsOtherTypes(String raw) {
        assertThatThrownBy(() -> ColumnType.fromSql(raw))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(raw);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  "})
    void fromSql_blankIsUntyped(String raw) {
        assertThat(ColumnType.fromSql(raw)).isEqualTo(ColumnType.NULL);
    }
}
