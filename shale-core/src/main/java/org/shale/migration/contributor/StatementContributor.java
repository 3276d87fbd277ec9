package org.shale.migration.contributor;

import org.shale.migration.spi.dialect.DdlDialect;

import java.util.List;

/**
 * Contributes complete statements to a multi-statement operation.
 */
public interface StatementContributor extends SqlContributor {
    void contribute(List<String> statements, DdlDialect dialect);
}
