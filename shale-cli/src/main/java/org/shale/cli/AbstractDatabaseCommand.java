package org.shale.cli;

import org.shale.options.ShaleOptions;
import picocli.CommandLine;

/**
 * Commands that also connect to a database.
 */
abstract class AbstractDatabaseCommand extends AbstractSchemaCommand {

    @CommandLine.Option(names = {"-u", "--url"}, description = "JDBC URL (예: jdbc:sqlite:app.db)")
    protected String url;

    protected String resolveUrl() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        String configured = configuration.get(ShaleOptions.Database.URL_KEY);
        if (configured == null || configured.isBlank()) {
            throw new IllegalArgumentException("No database URL. Pass --url or set database.url in "
                    + ShaleOptions.Profile.CONFIG_FILE);
        }
        return configured;
    }
}
