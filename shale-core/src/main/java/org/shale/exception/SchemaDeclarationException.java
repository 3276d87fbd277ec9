package org.shale.exception;

/**
 * A schema declaration is inconsistent: duplicate names, references to missing tables, columns
 * or indexes, or broken version numbering. Raised before any database is touched.
 */
public class SchemaDeclarationException extends MigrationException {

    public SchemaDeclarationException(String message) {
        super(message);
    }

    public SchemaDeclarationException(String message, Throwable cause) {
        super(message, cause);
    }
}
