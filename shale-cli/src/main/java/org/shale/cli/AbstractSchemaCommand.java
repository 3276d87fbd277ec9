package org.shale.cli;

import org.shale.cli.service.SchemaIoService;
import org.shale.config.ConfigurationLoader;
import org.shale.exception.MigrationExecutionException;
import org.shale.exception.SchemaDeclarationException;
import org.shale.options.ShaleOptions;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Options shared by every command that reads a schema definition. Values given on the command
 * line win over {@code shale.yaml}.
 */
abstract class AbstractSchemaCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-s", "--schema"}, description = "스키마 정의 파일 (YAML 또는 JSON)")
    protected Path schemaFile;

    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    protected String profile;

    protected Map<String, String> configuration;

    @Override
    public final Integer call() {
        try {
            configuration = loadConfiguration();
            if (schemaFile == null) {
                schemaFile = Path.of(configuration.get(ShaleOptions.Schema.FILE_KEY));
            }
            return run(new SchemaIoService());
        } catch (MigrationExecutionException e) {
            System.err.println(e.getMessage());
            System.err.println("Rolled back. The database is still at the version it had before the run.");
            return 1;
        } catch (SchemaDeclarationException e) {
            System.err.println("Invalid schema: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println(failurePrefix() + e.getMessage());
            return 1;
        }
    }

    protected abstract Integer run(SchemaIoService io) throws Exception;

    protected abstract String failurePrefix();

    protected Map<String, String> loadConfiguration() {
        return new ConfigurationLoader().loadConfiguration(profile);
    }

    protected boolean configFlag(String key, boolean defaultValue) {
        String raw = configuration.get(key);
        return raw == null ? defaultValue : Boolean.parseBoolean(raw);
    }
}
