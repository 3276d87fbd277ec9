package org.shale.cli;

import org.shale.cli.service.SchemaIoService;
import org.shale.schema.Schema;
import org.shale.schema.Version;
import picocli.CommandLine;

@CommandLine.Command(
        name = "inspect",
        mixinStandardHelpOptions = true,
        description = "선언된 스키마 버전의 테이블과 인덱스를 JSON 으로 출력합니다."
)
public class InspectCommand extends AbstractSchemaCommand {

    @CommandLine.Option(names = "--version-number", description = "조회할 버전 (기본값: 최신 버전)")
    private Integer versionNumber;

    @Override
    protected Integer run(SchemaIoService io) throws Exception {
        Schema schema = io.loadSchema(schemaFile);
        int n = versionNumber != null ? versionNumber : schema.latestVersionNumber();
        var version = schema.version(n);
        if (version.isEmpty()) {
            System.err.println("Version " + n + " is not declared (declared: "
                    + schema.firstVersionNumber() + ".." + schema.latestVersionNumber() + ")");
            return 1;
        }
        Version v = version.get();
        System.out.println(io.toJson(v));
        return 0;
    }

    @Override
    protected String failurePrefix() {
        return "Inspect failed: ";
    }
}
