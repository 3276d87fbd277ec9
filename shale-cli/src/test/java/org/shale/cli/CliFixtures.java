package org.shale.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class CliFixtures {

    static final String PEOPLE_SCHEMA = """
            identifier: people
            versions:
              - version: 1
                steps:
                  - createTable:
                      name: people
                      primaryKey: { column: id }
                      columns:
                        - { name: name, type: TEXT, constraints: [NOT NULL] }
                  - createIndex: { name: people_names, table: people, columns: [name], unique: true }
              - version: 2
                steps:
                  - alterTable:
                      name: people
                      edits:
                        - addColumn: { name: email, type: TEXT, setValue: "lower(name) || '@x.com'" }
              - version: 3
                steps:
                  - alterTable:
                      name: people
                      edits:
                        - alterColumn: { name: name, renameTo: full_name }
            """;

    private CliFixtures() {
    }

    static Path writeSchema(Path dir, String content) throws IOException {
        return Files.writeString(dir.resolve("schema.yaml"), content);
    }

    static String sqliteUrl(Path dir) {
        return "jdbc:sqlite:" + dir.resolve("app.db");
    }
}
