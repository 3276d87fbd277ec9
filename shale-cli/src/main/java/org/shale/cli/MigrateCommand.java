package org.shale.cli;

import org.shale.cli.service.SchemaIoService;
import org.shale.database.JdbcDatabase;
import org.shale.migration.MigrationOptions;
import org.shale.options.ShaleOptions;
import org.shale.schema.Schema;
import picocli.CommandLine;

import java.sql.Connection;

/**
 * Brings a database to a version of the schema.
 */
@CommandLine.Command(
        name = "migrate",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "데이터베이스를 지정한 스키마 버전으로 마이그레이션합니다."
)
public class MigrateCommand extends AbstractDatabaseCommand {

    @CommandLine.Option(names = "--to", description = "목표 버전 (기본값: 최신 버전)")
    private Integer toVersion;

    @CommandLine.Option(names = "--reset-unknown", description = "스키마에 없는 버전이 기록되어 있으면 모든 테이블을 지우고 처음부터 적용합니다.")
    private boolean resetUnknown;

    @CommandLine.Option(names = "--reset-on-downgrade", description = "더 낮은 버전을 요청하면 초기화 후 다시 적용합니다.")
    private boolean resetOnDowngrade;

    @Override
    protected Integer run(SchemaIoService io) throws Exception {
        Schema schema = io.loadSchema(schemaFile);
        int target = toVersion != null ? toVersion : schema.latestVersionNumber();
        MigrationOptions options = MigrationOptions.builder()
                .resetUnknownVersions(resetUnknown || configFlag(
                        ShaleOptions.Migration.RESET_UNKNOWN_VERSIONS_KEY,
                        ShaleOptions.Migration.RESET_UNKNOWN_VERSIONS_DEFAULT))
                .resetOnDowngrade(resetOnDowngrade)
                .checkForeignKeys(configFlag(
                        ShaleOptions.Migration.CHECK_FOREIGN_KEYS_KEY,
                        ShaleOptions.Migration.CHECK_FOREIGN_KEYS_DEFAULT))
                .build();

        try (Connection connection = io.openConnection(resolveUrl())) {
            JdbcDatabase database = new JdbcDatabase(connection);
            int before = database.readVersionNumber(schema.getIdentifier());
            if (!schema.migrate(database, target, options)) {
                System.out.println("Already at version " + target + ". No migration performed.");
                return 0;
            }
            System.out.println("Migrated from version " + before + " to " + target + ".");
            return 0;
        }
    }

    @Override
    protected String failurePrefix() {
        return "Migration failed: ";
    }
}
