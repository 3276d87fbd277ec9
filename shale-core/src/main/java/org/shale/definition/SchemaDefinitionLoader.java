package org.shale.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.shale.exception.SchemaDeclarationException;
import org.shale.model.ColumnType;
import org.shale.schema.Schema;
import org.shale.schema.SchemaBuilder;
import org.shale.schema.TableAlterer;
import org.shale.schema.TableBuilder;
import org.shale.schema.VersionBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads {@link SchemaDefinition} files and replays them into a {@link Schema}. Files ending in
 * {@code .json} are read as JSON, anything else as YAML.
 */
@Slf4j
public class SchemaDefinitionLoader {
    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public SchemaDefinitionLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.jsonMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Schema load(Path file) throws IOException {
        log.debug("Loading schema definition {}", file);
        ObjectMapper mapper = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
                ? jsonMapper : yamlMapper;
        try (InputStream in = Files.newInputStream(file)) {
            return toSchema(read(mapper, in));
        }
    }

    public Schema loadYaml(String content) {
        try {
            return toSchema(yamlMapper.readValue(content, SchemaDefinition.class));
        } catch (JsonProcessingException e) {
            throw new SchemaDeclarationException("Invalid schema definition: " + e.getOriginalMessage(), e);
        }
    }

    private static SchemaDefinition read(ObjectMapper mapper, InputStream in) throws IOException {
        try {
            return mapper.readValue(in, SchemaDefinition.class);
        } catch (JsonMappingException e) {
            throw new SchemaDeclarationException("Invalid schema definition: " + e.getOriginalMessage(), e);
        }
    }

    public Schema toSchema(SchemaDefinition definition) {
        if (definition == null || definition.getVersions() == null || definition.getVersions().isEmpty()) {
            throw new SchemaDeclarationException("Schema definition declares no versions");
        }
        SchemaBuilder builder = Schema.builder(definition.getIdentifier());
        for (SchemaDefinition.VersionDefinition version : definition.getVersions()) {
            List<SchemaDefinition.StepDefinition> steps = version.getSteps() == null ? List.of() : version.getSteps();
            builder.version(version.getVersion(), v -> steps.forEach(step -> applyStep(v, step)));
        }
        return builder.build();
    }

    private void applyStep(VersionBuilder v, SchemaDefinition.StepDefinition step) {
        List<Runnable> actions = new ArrayList<>();
        if (step.getCreateTable() != null) actions.add(() -> createTable(v, step.getCreateTable()));
        if (step.getAlterTable() != null) actions.add(() -> alterTable(v, step.getAlterTable()));
        if (step.getDropTable() != null) {
            actions.add(() -> v.dropTable(step.getDropTable().getName(), step.getDropTable().isIfExists()));
        }
        if (step.getRenameTable() != null) {
            actions.add(() -> v.renameTable(step.getRenameTable().getFrom(), step.getRenameTable().getTo()));
        }
        if (step.getCreateIndex() != null) actions.add(() -> createIndex(v, step.getCreateIndex()));
        if (step.getDropIndex() != null) {
            actions.add(() -> v.dropIndex(step.getDropIndex().getName(), step.getDropIndex().isIfExists()));
        }
        if (step.getRenameIndex() != null) {
            actions.add(() -> v.renameIndex(step.getRenameIndex().getFrom(), step.getRenameIndex().getTo()));
        }
        if (step.getExecute() != null) {
            String sql = step.getExecute().getSql();
            if (sql == null || sql.isBlank()) {
                throw new SchemaDeclarationException("execute step without sql");
            }
            actions.add(() -> v.executeSql(sql));
        }
        if (actions.size() != 1) {
            throw new SchemaDeclarationException("Each step must declare exactly one action, found " + actions.size());
        }
        actions.get(0).run();
    }

    private void createTable(VersionBuilder v, SchemaDefinition.CreateTableStep step) {
        v.createTable(step.getName(), t -> {
            if (step.getPrimaryKey() != null) {
                t.primaryKey(step.getPrimaryKey().getColumn(), step.getPrimaryKey().isAutoincrement());
            }
            for (SchemaDefinition.ColumnDefinition column : step.getColumns()) {
                t.column(column.getName(), columnType(column.getType()), nonNull(column.getConstraints()));
            }
            for (SchemaDefinition.ConstraintDefinition constraint : step.getConstraints()) {
                addTableConstraint(t, constraint);
            }
        });
    }

    private static void addTableConstraint(TableBuilder t, SchemaDefinition.ConstraintDefinition constraint) {
        if (constraint.getName() != null) {
            t.constraint(constraint.getName(), constraint.getDefinition());
        } else {
            t.constraint(constraint.getDefinition());
        }
    }

    private void alterTable(VersionBuilder v, SchemaDefinition.AlterTableStep step) {
        v.alterTable(step.getName(), t -> {
            for (SchemaDefinition.EditDefinition edit : step.getEdits()) {
                applyEdit(t, edit);
            }
        });
    }

    private void applyEdit(TableAlterer t, SchemaDefinition.EditDefinition edit) {
        int count = 0;
        if (edit.getAddColumn() != null) {
            count++;
            var c = edit.getAddColumn();
            t.addColumn(c.getName(), columnType(c.getType()), nonNull(c.getConstraints()), c.getSetValue());
        }
        if (edit.getAlterColumn() != null) {
            count++;
            var c = edit.getAlterColumn();
            var alteration = t.alterColumn(c.getName());
            if (c.getRenameTo() != null) alteration.renameTo(c.getRenameTo());
            if (c.getChangeTypeTo() != null) alteration.changeTypeTo(columnType(c.getChangeTypeTo()));
            if (c.getConstraints() != null) alteration.setConstraints(c.getConstraints());
            if (c.getSetValue() != null) alteration.setValue(c.getSetValue());
        }
        if (edit.getDropColumn() != null) {
            count++;
            t.dropColumn(edit.getDropColumn().getName());
        }
        if (edit.getAddConstraint() != null) {
            count++;
            var c = edit.getAddConstraint();
            if (c.getName() != null) t.addConstraint(c.getName(), c.getDefinition());
            else t.addConstraint(c.getDefinition());
        }
        if (edit.getDropConstraint() != null) {
            count++;
            var c = edit.getDropConstraint();
            if (c.getName() != null) t.dropConstraintNamed(c.getName());
            else t.dropConstraint(c.getDefinition());
        }
        if (Boolean.TRUE.equals(edit.getDropAllConstraints())) {
            count++;
            t.dropAllConstraints();
        }
        if (count != 1) {
            throw new SchemaDeclarationException("Each edit of table '" + t.getTableName()
                    + "' must declare exactly one change, found " + count);
        }
    }

    private void createIndex(VersionBuilder v, SchemaDefinition.CreateIndexStep step) {
        v.createIndex(step.getName(), step.getTable(), i -> {
            i.columns(step.getColumns().toArray(String[]::new));
            if (step.isUnique()) i.unique();
            if (step.getWhere() != null) i.where(step.getWhere());
            if (step.isIfNotExists()) i.ifNotExists();
        });
    }

    private static ColumnType columnType(String raw) {
        try {
            return ColumnType.fromSql(raw);
        } catch (IllegalArgumentException e) {
            throw new SchemaDeclarationException(e.getMessage(), e);
        }
    }

    private static List<String> nonNull(List<String> constraints) {
        return constraints == null ? List.of() : constraints;
    }
}
