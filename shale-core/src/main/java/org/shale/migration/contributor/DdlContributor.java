package org.shale.migration.contributor;

import org.shale.migration.spi.dialect.DdlDialect;

/**
 * Contributes definition fragments to the body of a single CREATE TABLE statement.
 */
public interface DdlContributor extends SqlContributor {
    void contribute(StringBuilder sb, DdlDialect dialect);
}
