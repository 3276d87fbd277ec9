package org.shale.migration.output;

import org.shale.migration.operation.ExecuteOperation;
import org.shale.migration.operation.MigrationOperation;
import org.shale.migration.spi.dialect.DdlDialect;
import org.shale.schema.Schema;
import org.shale.schema.Version;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders the statements a migration would run as a SQL script, without touching a database.
 * Execute steps cannot be rendered and appear as comments.
 */
public class SqlPlanWriter {
    private final DdlDialect dialect;

    public SqlPlanWriter(DdlDialect dialect) {
        this.dialect = dialect;
    }

    public String render(Schema schema, int fromVersion, int toVersion) {
        StringBuilder sb = new StringBuilder();
        sb.append("-- Schema '").append(schema.getIdentifier()).append("': version ")
                .append(fromVersion).append(" -> ").append(toVersion).append('\n');
        for (int n = Math.max(fromVersion + 1, schema.firstVersionNumber()); n <= toVersion; n++) {
            Version version = schema.version(n).orElseThrow();
            sb.append('\n').append("-- Version ").append(n).append('\n');
            for (MigrationOperation op : version.operations()) {
                appendOperation(sb, op);
            }
        }
        return sb.toString();
    }

    private void appendOperation(StringBuilder sb, MigrationOperation op) {
        if (op instanceof ExecuteOperation execute) {
            for (String line : execute.description().split("\\R")) {
                sb.append("-- execute: ").append(line).append('\n');
            }
            return;
        }
        for (String sql : dialect.render(op)) {
            sb.append(sql).append(";\n");
        }
    }

    public Path write(Schema schema, int fromVersion, int toVersion, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.writeString(file, render(schema, fromVersion, toVersion));
    }
}
