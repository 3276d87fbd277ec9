package org.shale.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.shale.options.ShaleOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = ShaleOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = ShaleOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = ShaleOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 해석된 설정 맵
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<ShaleConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 shale.yaml을 찾습니다.
     */
    private Optional<ShaleConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), ShaleConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(ShaleConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        if (profileConfig.getDatabase() != null && profileConfig.getDatabase().getUrl() != null) {
            configMap.put(ShaleOptions.Database.URL_KEY, profileConfig.getDatabase().getUrl());
        }
        if (profileConfig.getSchema() != null && profileConfig.getSchema().getFile() != null) {
            configMap.put(ShaleOptions.Schema.FILE_KEY, profileConfig.getSchema().getFile());
        }
        var migration = profileConfig.getMigration();
        if (migration != null) {
            if (migration.getResetUnknownVersions() != null) {
                configMap.put(ShaleOptions.Migration.RESET_UNKNOWN_VERSIONS_KEY,
                        String.valueOf(migration.getResetUnknownVersions()));
            }
            if (migration.getCheckForeignKeys() != null) {
                configMap.put(ShaleOptions.Migration.CHECK_FOREIGN_KEYS_KEY,
                        String.valueOf(migration.getCheckForeignKeys()));
            }
        }

        return configMap;
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                ShaleOptions.Schema.FILE_KEY, ShaleOptions.Schema.FILE_DEFAULT,
                ShaleOptions.Migration.RESET_UNKNOWN_VERSIONS_KEY,
                String.valueOf(ShaleOptions.Migration.RESET_UNKNOWN_VERSIONS_DEFAULT),
                ShaleOptions.Migration.CHECK_FOREIGN_KEYS_KEY,
                String.valueOf(ShaleOptions.Migration.CHECK_FOREIGN_KEYS_DEFAULT)
        );
    }
}
