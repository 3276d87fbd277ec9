package org.shale.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Contents of {@code shale.yaml}.
 */
@Data
public class ShaleConfiguration {

    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    public static class ProfileConfiguration {

        @JsonProperty("database")
        private DatabaseConfiguration database;

        @JsonProperty("schema")
        private SchemaConfiguration schema;

        @JsonProperty("migration")
        private MigrationConfiguration migration;
    }

    @Data
    public static class DatabaseConfiguration {

        /**
         * JDBC URL, e.g. {@code jdbc:sqlite:app.db}.
         */
        @JsonProperty("url")
        private String url;
    }

    @Data
    public static class SchemaConfiguration {

        @JsonProperty("file")
        private String file;
    }

    @Data
    public static class MigrationConfiguration {

        @JsonProperty("resetUnknownVersions")
        private Boolean resetUnknownVersions;

        @JsonProperty("checkForeignKeys")
        private Boolean checkForeignKeys;
    }
}
