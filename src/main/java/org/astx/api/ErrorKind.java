package org.astx.api;

/**
 * Classifies every failure the AST core can report.
 * Tests and callers match on the kind instead of on message text.
 */
public enum ErrorKind {
    /** A value lies outside the domain of its declared type (literal overflow, zero loop step). */
    VALUE,
    /** An operator or initializer combines types the promotion table does not allow. */
    TYPE,
    /** A construct is structurally invalid (non-addressable target, duplicate default case). */
    SYNTAX,
    /** A symbol table redefinition or lookup miss. */
    KEY,
    /** An index outside an ordered container. */
    INDEX,
    /** A visitor was asked to handle a node variant it does not implement. */
    NOT_IMPLEMENTED
}
