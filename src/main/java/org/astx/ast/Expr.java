package org.astx.ast;

import org.astx.ast.types.DataType;

/**
 * A node that produces a value. Its result type is fixed when the node is constructed.
 */
public abstract class Expr extends AstNode {

    /**
     * @return The statically declared type of the value this expression produces.
     */
    public abstract DataType type();
}
