package org.astx.ast.flows;

import org.astx.ast.AstKind;
import org.astx.ast.Statement;
import org.astx.ast.visitor.AstVisitor;
import org.astx.serialization.StructBuilder;

/**
 * Leaves the innermost loop.
 */
public final class BreakStmt extends Statement {

    @Override
    public AstKind kind() {
        return AstKind.BREAK_STMT;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBreakStmt(this);
    }

    @Override
    protected void buildStruct(StructBuilder struct) {
        // no content
    }

    @Override
    public String toString() {
        return "BreakStmt";
    }
}
