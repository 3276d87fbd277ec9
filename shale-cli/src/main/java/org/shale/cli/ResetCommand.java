package org.shale.cli;

import org.shale.cli.service.SchemaIoService;
import org.shale.database.JdbcDatabase;
import org.shale.schema.Schema;
import picocli.CommandLine;

import java.sql.Connection;

@CommandLine.Command(
        name = "reset",
        mixinStandardHelpOptions = true,
        description = "스키마에 선언된 모든 테이블과 인덱스를 삭제하고 버전을 0으로 되돌립니다."
)
public class ResetCommand extends AbstractDatabaseCommand {

    @Override
    protected Integer run(SchemaIoService io) throws Exception {
        Schema schema = io.loadSchema(schemaFile);
        try (Connection connection = io.openConnection(resolveUrl())) {
            schema.reset(new JdbcDatabase(connection));
        }
        System.out.println("Database reset to version 0.");
        return 0;
    }

    @Override
    protected String failurePrefix() {
        return "Reset failed: ";
    }
}
