package org.astx.ast.modifiers;

import org.astx.api.InvalidValueException;

import java.util.Locale;

/**
 * Who may refer to a declared name from outside its declaring scope.
 */
public enum VisibilityKind {
    PUBLIC,
    PRIVATE,
    PROTECTED;

    /**
     * @return The lowercase label used in structural representations.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a label produced by {@link #label()}.
     */
    public static VisibilityKind fromLabel(String label) {
        for (VisibilityKind value : values()) {
            if (value.label().equals(label)) {
                return value;
            }
        }
        throw new InvalidValueException("Unknown VisibilityKind: " + label);
    }
}
