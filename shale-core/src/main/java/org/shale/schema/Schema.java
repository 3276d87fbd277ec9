package org.shale.schema;

import lombok.extern.slf4j.Slf4j;
import org.shale.database.Database;
import org.shale.exception.SchemaDeclarationException;
import org.shale.migration.MigrationOptions;
import org.shale.migration.SchemaMigrator;
import org.shale.migration.compiler.AlterTableCompiler;
import org.shale.migration.compiler.IndexRemapper;
import org.shale.migration.operation.MigrationOperation;
import org.shale.model.SchemaSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.IntStream;

/**
 * An ordered chain of versions describing how a database schema evolves.
 *
 * <pre>{@code
 * Schema schema = Schema.builder("app")
 *         .version(1, v -> v.createTable("people", t -> t
 *                 .primaryKey("id")
 *                 .column("name", ColumnType.TEXT, "NOT NULL")))
 *         .version(2, v -> v.alterTable("people", t -> t
 *                 .addColumn("email", ColumnType.TEXT, List.of(), "lower(name) || '@x.com'")))
 *         .build();
 * schema.migrate(database);
 * }</pre>
 *
 * <p>Versions are compiled on first use, each one from the snapshot of the version before it,
 * and cached. A schema is safe to share between threads.
 *
 * <p>{@link SchemaBuilder#build()} only checks version numbering. A declaration error in a
 * version surfaces when that version, or a later one, is first compiled, so a schema whose
 * version 3 is broken still answers {@code version(1)}. Call {@link #validate()} to compile
 * every version up front. {@link #migrate} and {@link #reset} validate before they touch the
 * database.
 */
@Slf4j
public class Schema {
    private final String identifier;
    private final List<SchemaBuilder.VersionDeclaration> declarations;
    private final List<Version> compiled = new ArrayList<>();
    private final IndexRemapper indexRemapper = new IndexRemapper();
    private final AlterTableCompiler alterTableCompiler = new AlterTableCompiler(indexRemapper);

    public Schema(String identifier, Consumer<SchemaBuilder> declare) {
        this(identifier, collect(identifier, declare));
    }

    Schema(String identifier, List<SchemaBuilder.VersionDeclaration> declarations) {
        if (declarations.isEmpty()) {
            throw new SchemaDeclarationException("Schema '" + identifier + "' declares no versions");
        }
        this.identifier = identifier;
        this.declarations = declarations;
    }

    public static SchemaBuilder builder(String identifier) {
        return new SchemaBuilder(identifier);
    }

    private static List<SchemaBuilder.VersionDeclaration> collect(String identifier, Consumer<SchemaBuilder> declare) {
        SchemaBuilder builder = new SchemaBuilder(identifier);
        declare.accept(builder);
        return List.copyOf(builder.declarations());
    }

    /**
     * Namespace of the persisted version number, or null for the database-wide counter.
     */
    public String getIdentifier() {
        return identifier;
    }

    public int firstVersionNumber() {
        return declarations.get(0).number();
    }

    public int latestVersionNumber() {
        return declarations.get(declarations.size() - 1).number();
    }

    public List<Integer> versionNumbers() {
        return IntStream.rangeClosed(firstVersionNumber(), latestVersionNumber()).boxed().toList();
    }

    public boolean declares(int versionNumber) {
        return versionNumber >= firstVersionNumber() && versionNumber <= latestVersionNumber();
    }

    public Optional<Version> version(int versionNumber) {
        if (!declares(versionNumber)) {
            return Optional.empty();
        }
        return Optional.of(compile(versionNumber));
    }

    public Version latestVersion() {
        return compile(latestVersionNumber());
    }

    /**
     * Compiles every version, surfacing declaration errors.
     *
     * @return this schema
     */
    public Schema validate() {
        latestVersion();
        return this;
    }

    /**
     * Operations that take a database from version {@code from} to version {@code to}, in
     * execution order. {@code from} may be 0 for an empty database.
     */
    public List<MigrationOperation> operationsBetween(int from, int to) {
        List<MigrationOperation> ops = new ArrayList<>();
        for (int n = Math.max(from + 1, firstVersionNumber()); n <= to; n++) {
            ops.addAll(compile(n).operations());
        }
        return ops;
    }

    /**
     * Every table name that appears in any version.
     */
    public Set<String> knownTableNames() {
        Set<String> names = new LinkedHashSet<>();
        for (int n : versionNumbers()) {
            names.addAll(compile(n).snapshot().tableNames());
        }
        return names;
    }

    public Set<String> knownIndexNames() {
        Set<String> names = new LinkedHashSet<>();
        for (int n : versionNumbers()) {
            names.addAll(compile(n).snapshot().indexNames());
        }
        return names;
    }

    public boolean migrate(Database database) {
        return migrate(database, latestVersionNumber());
    }

    public boolean migrate(Database database, int toVersion) {
        return migrate(database, toVersion, MigrationOptions.defaults());
    }

    /**
     * Moves the database from its recorded version to {@code toVersion} in one transaction.
     *
     * @return false when the database already was at {@code toVersion}
     */
    public boolean migrate(Database database, int toVersion, MigrationOptions options) {
        return new SchemaMigrator(this).migrate(database, toVersion, options);
    }

    /**
     * Drops every table and index any version declares and records version 0.
     */
    public void reset(Database database) {
        new SchemaMigrator(this).reset(database);
    }

    private synchronized Version compile(int versionNumber) {
        int first = firstVersionNumber();
        while (compiled.size() <= versionNumber - first) {
            SchemaBuilder.VersionDeclaration declaration = declarations.get(compiled.size());
            SchemaSnapshot previous = compiled.isEmpty()
                    ? SchemaSnapshot.EMPTY
                    : compiled.get(compiled.size() - 1).snapshot();
            compiled.add(compileDeclaration(declaration, previous));
        }
        return compiled.get(versionNumber - first);
    }

    private Version compileDeclaration(SchemaBuilder.VersionDeclaration declaration, SchemaSnapshot previous) {
        VersionBuilder builder = new VersionBuilder(declaration.number(), previous, alterTableCompiler, indexRemapper);
        try {
            declaration.block().accept(builder);
        } catch (SchemaDeclarationException e) {
            throw new SchemaDeclarationException("Version " + declaration.number() + ": " + e.getMessage(), e);
        }
        Version version = builder.build();
        log.debug("Compiled version {} of schema '{}': {} operation(s), tables {}",
                version.number(), identifier, version.operations().size(), version.snapshot().tableNames());
        return version;
    }

    @Override
    public String toString() {
        return "Schema{identifier=" + identifier + ", versions=" + firstVersionNumber() + ".." + latestVersionNumber() + "}";
    }
}
