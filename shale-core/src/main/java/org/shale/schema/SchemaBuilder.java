package org.shale.schema;

import org.shale.exception.SchemaDeclarationException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Collects version declarations. Numbering is checked as versions are added: the first version
 * is at least 1 and each following version is exactly one more than the previous.
 */
public class SchemaBuilder {
    private final String identifier;
    private final List<VersionDeclaration> declarations = new ArrayList<>();

    record VersionDeclaration(int number, Consumer<VersionBuilder> block) {
    }

    SchemaBuilder(String identifier) {
        this.identifier = identifier;
    }

    public SchemaBuilder version(int number, Consumer<VersionBuilder> block) {
        if (declarations.isEmpty()) {
            if (number < 1) {
                throw new SchemaDeclarationException("Version numbers start at 1, got " + number);
            }
        } else {
            int previous = declarations.get(declarations.size() - 1).number();
            if (number != previous + 1) {
                throw new SchemaDeclarationException("Version " + number + " declared after version " + previous
                        + ": versions must be consecutive");
            }
        }
        declarations.add(new VersionDeclaration(number, block));
        return this;
    }

    public Schema build() {
        return new Schema(identifier, List.copyOf(declarations));
    }

    List<VersionDeclaration> declarations() {
        return declarations;
    }
}
