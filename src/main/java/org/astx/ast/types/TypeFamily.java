package org.astx.ast.types;

/**
 * Coarse grouping of data types used by the compatibility query and the promotion table.
 */
public enum TypeFamily {
    INTEGER,
    FLOAT,
    COMPLEX,
    BOOLEAN,
    TEXT,
    TEMPORAL,
    COLLECTION,
    NAMED,
    FUNCTION,
    NONE,
    UNDEFINED,
    ANY;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT || this == COMPLEX;
    }
}
