package org.shale.definition;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A schema written as a YAML or JSON file.
 *
 * <pre>
 * identifier: app
 * versions:
 *   - version: 1
 *     steps:
 *       - createTable:
 *           name: people
 *           primaryKey: { column: id }
 *           columns:
 *             - { name: name, type: TEXT, constraints: [ "NOT NULL" ] }
 * </pre>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchemaDefinition {
    private String identifier;
    private List<VersionDefinition> versions = new ArrayList<>();

    @Data
    public static class VersionDefinition {
        private int version;
        private List<StepDefinition> steps = new ArrayList<>();
    }

    /**
     * Exactly one property is set per step.
     */
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StepDefinition {
        private CreateTableStep createTable;
        private AlterTableStep alterTable;
        private DropTableStep dropTable;
        private RenameStep renameTable;
        private CreateIndexStep createIndex;
        private DropIndexStep dropIndex;
        private RenameStep renameIndex;
        private ExecuteStep execute;
    }

    @Data
    public static class CreateTableStep {
        private String name;
        private PrimaryKeyDefinition primaryKey;
        private List<ColumnDefinition> columns = new ArrayList<>();
        private List<ConstraintDefinition> constraints = new ArrayList<>();
    }

    @Data
    public static class PrimaryKeyDefinition {
        private String column;
        private boolean autoincrement;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ColumnDefinition {
        private String name;
        private String type;
        private List<String> constraints = new ArrayList<>();
        private String setValue;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ConstraintDefinition {
        private String name;
        private String definition;
    }

    @Data
    public static class AlterTableStep {
        private String name;
        private List<EditDefinition> edits = new ArrayList<>();
    }

    /**
     * Exactly one property is set per edit.
     */
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EditDefinition {
        private ColumnDefinition addColumn;
        private AlterColumnDefinition alterColumn;
        private NameRef dropColumn;
        private ConstraintDefinition addConstraint;
        private ConstraintDefinition dropConstraint;
        private Boolean dropAllConstraints;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AlterColumnDefinition {
        private String name;
        private String renameTo;
        private String changeTypeTo;
        private List<String> constraints;
        private String setValue;
    }

    @Data
    public static class NameRef {
        private String name;
    }

    @Data
    public static class DropTableStep {
        private String name;
        private boolean ifExists;
    }

    @Data
    public static class RenameStep {
        @JsonProperty("from")
        private String from;
        @JsonProperty("to")
        private String to;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CreateIndexStep {
        private String name;
        private String table;
        private List<String> columns = new ArrayList<>();
        private boolean unique;
        private String where;
        private boolean ifNotExists;
    }

    @Data
    public static class DropIndexStep {
        private String name;
        private boolean ifExists;
    }

    @Data
    public static class ExecuteStep {
        private String sql;
    }
}
