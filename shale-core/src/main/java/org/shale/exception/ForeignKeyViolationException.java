package org.shale.exception;

import lombok.Getter;
import org.shale.database.ForeignKeyViolation;
import org.shale.migration.operation.OperationKind;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class ForeignKeyViolationException extends MigrationExecutionException {
    private final List<ForeignKeyViolation> violations;

    public ForeignKeyViolationException(int versionNumber, String tableName, List<ForeignKeyViolation> violations) {
        super(versionNumber, OperationKind.REBUILD_TABLE, tableName, describe(versionNumber, tableName, violations), null);
        this.violations = List.copyOf(violations);
    }

    private static String describe(int versionNumber, String tableName, List<ForeignKeyViolation> violations) {
        String pairs = violations.stream()
                .map(v -> v.getTableName() + " REFERENCES " + v.getParentTableName())
                .distinct()
                .collect(Collectors.joining(", "));
        return "Migration to version " + versionNumber + " violated foreign keys after rebuilding '"
                + tableName + "': " + pairs;
    }
}
