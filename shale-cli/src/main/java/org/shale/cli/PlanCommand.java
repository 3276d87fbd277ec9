package org.shale.cli;

import org.shale.cli.service.SchemaIoService;
import org.shale.database.JdbcDatabase;
import org.shale.migration.dialect.sqlite.SqliteDialect;
import org.shale.migration.output.SqlPlanWriter;
import org.shale.options.ShaleOptions;
import org.shale.schema.Schema;
import picocli.CommandLine;

import java.nio.file.Path;
import java.sql.Connection;

/**
 * Prints or saves the SQL a migration would run. Nothing is executed.
 */
@CommandLine.Command(
        name = "plan",
        mixinStandardHelpOptions = true,
        description = "마이그레이션이 실행할 SQL을 미리 생성합니다 (실행하지 않음)."
)
public class PlanCommand extends AbstractDatabaseCommand {

    @CommandLine.Option(names = "--from", description = "시작 버전 (기본값: --url 이 있으면 기록된 버전, 없으면 0)")
    private Integer fromVersion;

    @CommandLine.Option(names = "--to", description = "목표 버전 (기본값: 최신 버전)")
    private Integer toVersion;

    @CommandLine.Option(names = "--out", description = "SQL 을 저장할 파일 (생략 시 표준 출력)")
    private Path outputFile;

    @Override
    protected Integer run(SchemaIoService io) throws Exception {
        Schema schema = io.loadSchema(schemaFile);
        int from = fromVersion != null ? fromVersion : recordedVersion(io, schema);
        int to = toVersion != null ? toVersion : schema.latestVersionNumber();
        if (to > schema.latestVersionNumber() || from < 0 || from > to) {
            System.err.println("Invalid version range: " + from + " -> " + to);
            return 1;
        }

        SqlPlanWriter writer = new SqlPlanWriter(new SqliteDialect());
        if (outputFile != null) {
            writer.write(schema, from, to, outputFile);
            System.out.println("Plan written to " + outputFile);
        } else {
            System.out.print(writer.render(schema, from, to));
        }
        return 0;
    }

    private int recordedVersion(SchemaIoService io, Schema schema) throws Exception {
        if (url == null && configuration.get(ShaleOptions.Database.URL_KEY) == null) {
            return 0;
        }
        try (Connection connection = io.openConnection(resolveUrl())) {
            return new JdbcDatabase(connection).readVersionNumber(schema.getIdentifier());
        }
    }

    @Override
    protected String failurePrefix() {
        return "Plan failed: ";
    }
}
