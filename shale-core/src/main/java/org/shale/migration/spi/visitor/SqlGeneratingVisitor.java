package org.shale.migration.spi.visitor;

import java.util.List;

public interface SqlGeneratingVisitor extends MigrationVisitor {
    List<String> getStatements();
}
