package org.astx.ast.modifiers;

import org.astx.api.InvalidValueException;

import java.util.Locale;

/**
 * Whether a declared name may be reassigned.
 */
public enum MutabilityKind {
    CONSTANT,
    MUTABLE;

    /**
     * @return The lowercase label used in structural representations.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a label produced by {@link #label()}.
     */
    public static MutabilityKind fromLabel(String label) {
        for (MutabilityKind value : values()) {
            if (value.label().equals(label)) {
                return value;
            }
        }
        throw new InvalidValueException("Unknown MutabilityKind: " + label);
    }
}
