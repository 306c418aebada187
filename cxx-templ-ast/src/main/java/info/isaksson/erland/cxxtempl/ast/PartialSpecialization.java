package info.isaksson.erland.cxxtempl.ast;

import info.isaksson.erland.cxxtempl.types.ParmList;

import java.util.Objects;

/**
 * A partial specialization attached to its primary template.
 *
 * <p>The pattern is kept on the definition node ({@link Node#partialArgs}); each entry embeds at
 * most one placeholder {@code $k} naming the definition's k-th formal parameter.</p>
 */
public final class PartialSpecialization {

    /** Display name, e.g. {@code Box<p.$1>}. */
    public final String displayName;
    public final Node definition;

    public PartialSpecialization(String displayName, Node definition) {
        this.displayName = Objects.requireNonNull(displayName, "displayName must not be null");
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        if (definition.partialArgs == null) {
            throw new IllegalArgumentException("partial specialization '" + displayName + "' has no pattern");
        }
    }

    public ParmList pattern() {
        return definition.partialArgs;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
