package org.shale.cli;

import picocli.CommandLine;

/**
 * Command line entry point: applies, inspects and previews versioned SQLite schemas declared in
 * schema definition files.
 */
@CommandLine.Command(
        name = "shale",
        mixinStandardHelpOptions = true,
        version = "shale 1.0",
        description = "버전 기반 SQLite 스키마 마이그레이션 툴",
        subcommands = {
                DbCommand.class,
                SchemaCommand.class
        }
)
public class ShaleCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new ShaleCli()).execute(args);
        System.exit(exitCode);
    }
}
