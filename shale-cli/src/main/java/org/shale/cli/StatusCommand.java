package org.shale.cli;

import org.shale.cli.service.SchemaIoService;
import org.shale.database.IndexInfo;
import org.shale.database.JdbcDatabase;
import org.shale.schema.Schema;
import picocli.CommandLine;

import java.sql.Connection;

/**
 * Shows the recorded version against the declared versions, and what the database holds.
 */
@CommandLine.Command(
        name = "status",
        mixinStandardHelpOptions = true,
        description = "기록된 버전과 대기 중인 버전, 현재 테이블과 인덱스를 보여줍니다."
)
public class StatusCommand extends AbstractDatabaseCommand {

    @Override
    protected Integer run(SchemaIoService io) throws Exception {
        Schema schema = io.loadSchema(schemaFile);
        try (Connection connection = io.openConnection(resolveUrl())) {
            JdbcDatabase database = new JdbcDatabase(connection);
            int current = database.readVersionNumber(schema.getIdentifier());
            int latest = schema.latestVersionNumber();

            System.out.println("Schema:   " + (schema.getIdentifier() == null ? "(default)" : schema.getIdentifier()));
            System.out.println("Database: version " + current);
            System.out.println("Declared: versions " + schema.firstVersionNumber() + ".." + latest);
            if (current != 0 && !schema.declares(current)) {
                System.out.println("Status:   unknown version (not declared by the schema)");
            } else if (current < latest) {
                System.out.println("Status:   " + (latest - current) + " pending version(s)");
            } else {
                System.out.println("Status:   up to date");
            }

            System.out.println("Tables:");
            for (String table : database.listTables()) {
                System.out.println("  " + table);
            }
            System.out.println("Indexes:");
            for (IndexInfo index : database.listIndexes()) {
                System.out.println("  " + index.getName() + " ON " + index.getTableName() + " "
                        + index.getColumns() + (index.isUnique() ? " UNIQUE" : ""));
            }
        }
        return 0;
    }

    @Override
    protected String failurePrefix() {
        return "Status failed: ";
    }
}
