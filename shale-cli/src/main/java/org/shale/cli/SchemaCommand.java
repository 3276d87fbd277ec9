package org.shale.cli;

import picocli.CommandLine;

@CommandLine.Command(
        name = "schema",
        mixinStandardHelpOptions = true,
        description = "스키마 정의 관련 명령어",
        subcommands = {
                InspectCommand.class
        }
)
public class SchemaCommand {

}
