package org.astx.symbols;

/**
 * The kind of declaration a symbol stands for.
 */
public enum SymbolKind {
    /** A mutable variable, including loop variables. */
    VARIABLE,
    /** A variable declared constant. */
    CONSTANT,
    /** A formal parameter of a function or lambda. */
    ARGUMENT,
    /** A function prototype or definition. */
    FUNCTION,
    /** A class declaration or definition. */
    CLASS,
    /** A struct declaration or definition. */
    STRUCT,
    /** An enumeration. */
    ENUM,
    /** A name bound by an import. */
    IMPORT
}
