package org.shale.migration;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class MigrationOptions {
    /**
     * Drop every user table and start over when the recorded version is not declared by the
     * schema, instead of failing.
     */
    @Builder.Default boolean resetUnknownVersions = false;

    /**
     * Reach a lower target by resetting and migrating forward, instead of failing.
     */
    @Builder.Default boolean resetOnDowngrade = false;

    /**
     * Run {@code PRAGMA foreign_key_check} after every table rebuild.
     */
    @Builder.Default boolean checkForeignKeys = true;

    public static MigrationOptions defaults() {
        return MigrationOptions.builder().build();
    }
}
