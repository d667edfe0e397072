package org.astx.ast;

/**
 * A position in the source the tree was built from.
 *
 * @param line The 1-based line, or -1 when unknown.
 * @param col  The 1-based column, or -1 when unknown.
 */
public record SourceLocation(int line, int col) {

    /** Marker for nodes that were not produced from source text. */
    public static final SourceLocation NONE = new SourceLocation(-1, -1);

    public boolean isKnown() {
        return line >= 0 || col >= 0;
    }

    @Override
    public String toString() {
        return "{line: " + line + ", col: " + col + "}";
    }
}
