package org.shale.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Table-level constraint such as {@code UNIQUE (a, b)} or {@code CHECK (price > 0)}.
 * The name is optional.
 */
@Value
@Builder(toBuilder = true)
public class ConstraintModel {
    String name;
    String definition;

    public static ConstraintModel of(String definition) {
        return new ConstraintModel(null, definition);
    }

    public static ConstraintModel named(String name, String definition) {
        return new ConstraintModel(name, definition);
    }

    @JsonIgnore
    public boolean isNamed() {
        return name != null && !name.isBlank();
    }
}
