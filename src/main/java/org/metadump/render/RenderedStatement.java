package org.metadump.render;

import java.util.Objects;

/**
 * Text produced for one emission step.
 *
 * @param statement  the primary statement text; empty if the object needs no statement.
 * @param annotation trailing ownership, comment and privilege statements; may be empty.
 */
public record RenderedStatement(String statement, String annotation) {

    public static final RenderedStatement EMPTY = new RenderedStatement("", "");

    public RenderedStatement {
        statement = Objects.requireNonNullElse(statement, "");
        annotation = Objects.requireNonNullElse(annotation, "");
    }

    public static RenderedStatement of(String statement) {
        return new RenderedStatement(statement, "");
    }

    public boolean isEmpty() {
        return statement.isEmpty() && annotation.isEmpty();
    }
}
