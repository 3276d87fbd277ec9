package org.shale.options;

/**
 * Configuration keys and defaults shared by the configuration loader and the CLI.
 */
public final class ShaleOptions {

    private ShaleOptions() {
    }

    public static final class Profile {
        private Profile() {}

        public static final String DEFAULT = "dev";

        public static final String ENV_VAR = "SHALE_PROFILE";

        /**
         * Searched for in the working directory and its parents.
         */
        public static final String CONFIG_FILE = "shale.yaml";
    }

    public static final class Database {
        private Database() {}

        public static final String URL_KEY = "shale.database.url";
    }

    public static final class Schema {
        private Schema() {}

        public static final String FILE_KEY = "shale.schema.file";
        public static final String FILE_DEFAULT = "schema.yaml";
    }

    public static final class Migration {
        private Migration() {}

        public static final String RESET_UNKNOWN_VERSIONS_KEY = "shale.migration.resetUnknownVersions";
        public static final boolean RESET_UNKNOWN_VERSIONS_DEFAULT = false;

        public static final String CHECK_FOREIGN_KEYS_KEY = "shale.migration.checkForeignKeys";
        public static final boolean CHECK_FOREIGN_KEYS_DEFAULT = true;
    }
}
