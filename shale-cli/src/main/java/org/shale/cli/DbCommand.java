package org.shale.cli;

import picocli.CommandLine;

@CommandLine.Command(
        name = "db",
        mixinStandardHelpOptions = true,
        description = "데이터베이스 관련 명령어",
        subcommands = {
                MigrateCommand.class,
                ResetCommand.class,
                StatusCommand.class,
                PlanCommand.class
        }
)
public class DbCommand {

}
