package org.shale.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.shale.options.ShaleOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    private static final String YAML = """
            profiles:
              dev:
                database:
                  url: jdbc:sqlite:dev.db
                schema:
                  file: db/schema.yaml
              prod:
                database:
                  url: jdbc:sqlite:/var/lib/app/app.db
                migration:
                  resetUnknownVersions: true
                  checkForeignKeys: false
            """;

    @Test
    @DisplayName("설정 파일이 없으면 기본값을 반환한다")
    void loadConfiguration_noFile_returnsDefaults(@TempDir Path tempDir) {
        // given
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when
        Map<String, String> config = loader.loadConfiguration("dev");

        // then
        assertEquals(ShaleOptions.Schema.FILE_DEFAULT, config.get(ShaleOptions.Schema.FILE_KEY));
        assertEquals("false", config.get(ShaleOptions.Migration.RESET_UNKNOWN_VERSIONS_KEY));
        assertEquals("true", config.get(ShaleOptions.Migration.CHECK_FOREIGN_KEYS_KEY));
        assertNull(config.get(ShaleOptions.Database.URL_KEY));
    }

    @Test
    @DisplayName("설정 파일에서 지정된 프로파일의 값을 로드한다")
    void loadConfiguration_withProfile_loadsCorrectValues(@TempDir Path tempDir) throws IOException {
        // given
        Files.writeString(tempDir.resolve("shale.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        // when - dev 프로파일
        Map<String, String> devConfig = loader.loadConfiguration("dev");

        // then - dev 프로파일
        assertEquals("jdbc:sqlite:dev.db", devConfig.get(ShaleOptions.Database.URL_KEY));
        assertEquals("db/schema.yaml", devConfig.get(ShaleOptions.Schema.FILE_KEY));
        assertEquals("true", devConfig.get(ShaleOptions.Migration.CHECK_FOREIGN_KEYS_KEY));

        // when - prod 프로파일
        Map<String, String> prodConfig = loader.loadConfiguration("prod");

        // then - prod 프로파일
        assertEquals("jdbc:sqlite:/var/lib/app/app.db", prodConfig.get(ShaleOptions.Database.URL_KEY));
        assertEquals(ShaleOptions.Schema.FILE_DEFAULT, prodConfig.get(ShaleOptions.Schema.FILE_KEY));
        assertEquals("true", prodConfig.get(ShaleOptions.Migration.RESET_UNKNOWN_VERSIONS_KEY));
        assertEquals("false", prodConfig.get(ShaleOptions.Migration.CHECK_FOREIGN_KEYS_KEY));
    }

    @Test
    @DisplayName("존재하지 않는 프로파일을 요청하면 기본값을 반환한다")
    void loadConfiguration_nonExistentProfile_returnsDefaults(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("shale.yaml"), YAML);
        ConfigurationLoader loader = new ConfigurationLoader(tempDir, name -> null);

        Map<String, String> config = loader.loadConfiguration("staging");

        assertNull(config.get(ShaleOptions.Database.URL_KEY));
        assertEquals(ShaleOptions.Schema.FILE_DEFAULT, config.get(ShaleOptions.Schema.FILE_KEY));
    }

    @Test
    @DisplayName("상위 디렉토리의 설정 파일을 찾는다")
    void loadConfiguration_searchesParentDirectories(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("shale.yaml"), YAML);
        Path nested = Files.createDirectories(tempDir.resolve("service/src"));

        Map<String, String> config = new ConfigurationLoader(nested, name -> null).loadConfiguration(null);

        assertEquals("jdbc:sqlite:dev.db", config.get(ShaleOptions.Database.URL_KEY));
    }

    @Test
    @DisplayName("잘못된 설정 파일은 무시하고 기본값을 쓴다")
    void loadConfiguration_malformedFile_returnsDefaults(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("shale.yaml"), "profiles: [not, a, map");

        Map<String, String> config = new ConfigurationLoader(tempDir, name -> null).loadConfiguration("dev");

        assertEquals(ShaleOptions.Schema.FILE_DEFAULT, config.get(ShaleOptions.Schema.FILE_KEY));
    }

    @Test
    @DisplayName("프로파일 우선순위: CLI > 환경변수 > dev")
    void resolveActiveProfile_precedence(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("shale.yaml"), YAML);
        Map<String, String> env = Map.of(ShaleOptions.Profile.ENV_VAR, "prod");

        ConfigurationLoader withEnv = new ConfigurationLoader(tempDir, env::get);
        ConfigurationLoader withoutEnv = new ConfigurationLoader(tempDir, name -> null);

        assertEquals("staging", withEnv.resolveActiveProfile("staging"));
        assertEquals("prod", withEnv.resolveActiveProfile(null));
        assertEquals("prod", withEnv.resolveActiveProfile("  "));
        assertEquals("dev", withoutEnv.resolveActiveProfile(null));

        assertEquals("jdbc:sqlite:/var/lib/app/app.db",
                withEnv.loadConfiguration(null).get(ShaleOptions.Database.URL_KEY));
    }
}
