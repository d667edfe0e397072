package org.astx.ast.modifiers;

import org.astx.api.InvalidValueException;

import java.util.Locale;

/**
 * Where a declared name lives.
 */
public enum ScopeKind {
    GLOBAL,
    LOCAL;

    /**
     * @return The lowercase label used in structural representations.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a label produced by {@link #label()}.
     */
    public static ScopeKind fromLabel(String label) {
        for (ScopeKind value : values()) {
            if (value.label().equals(label)) {
                return value;
            }
        }
        throw new InvalidValueException("Unknown ScopeKind: " + label);
    }
}
