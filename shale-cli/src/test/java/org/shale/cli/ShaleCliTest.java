package org.shale.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ShaleCliTest {

    @TempDir Path tmp;

    @Test
    @DisplayName("스키마 파일 미존재 -> exit-1 + 오류메시지")
    void schemaFileNotFound() {
        Path missing = tmp.resolve("no_such_schema.yaml");
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = new CommandLine(new ShaleCli())
                    .execute("db", "migrate", "-s", missing.toString(), "-u", CliFixtures.sqliteUrl(tmp));

            assertThat(code).isEqualTo(1);
            assertThat(sc.err()).contains("Schema file not found");
        }
    }

    @Test
    @DisplayName("URL 이 없으면 exit-1")
    void missingUrl() throws Exception {
        Path schema = CliFixtures.writeSchema(tmp, CliFixtures.PEOPLE_SCHEMA);
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = new CommandLine(new ShaleCli())
                    .execute("db", "status", "-s", schema.toString());

            assertThat(code).isEqualTo(1);
            assertThat(sc.err()).contains("No database URL");
        }
    }

    @Test
    @DisplayName("잘못된 스키마 정의 -> Invalid schema")
    void invalidSchema() throws Exception {
        Path schema = CliFixtures.writeSchema(tmp, """
                versions:
                  - version: 1
                    steps:
                      - dropTable: { name: ghosts }
                """);
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = new CommandLine(new ShaleCli())
                    .execute("db", "migrate", "-s", schema.toString(), "-u", CliFixtures.sqliteUrl(tmp));

            assertThat(code).isEqualTo(1);
            assertThat(sc.err()).contains("Invalid schema").contains("ghosts");
        }
    }

    @Test
    void versionOption() {
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = new CommandLine(new ShaleCli()).execute("--version");

            assertThat(code).isZero();
            assertThat(sc.out()).contains("shale 1.0");
        }
    }

    @Test
    void helpListsSubcommands() {
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = new CommandLine(new ShaleCli()).execute("db", "--help");

            assertThat(code).isZero();
            assertThat(sc.out()).contains("migrate", "reset", "status", "plan");
        }
    }

    @Test
    void schemaHelpListsInspect() {
        try (StreamCaptor sc = new StreamCaptor()) {
            int code = new CommandLine(new ShaleCli()).execute("schema", "--help");

            assertThat(code).isZero();
            assertThat(sc.out()).contains("inspect");
        }
    }
}
