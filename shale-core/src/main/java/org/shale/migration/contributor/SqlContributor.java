package org.shale.migration.contributor;

public interface SqlContributor {
    /**
     * Lower values are emitted first.
     */
    int priority();
}
